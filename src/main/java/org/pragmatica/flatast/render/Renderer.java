package org.pragmatica.flatast.render;

import org.pragmatica.flatast.tree.FlatStore;

/**
 * Renderer interface - regenerates source text from a flat store.
 */
public interface Renderer {

    /**
     * Render the whole tree, starting at the root address.
     */
    String render(FlatStore store);

    /**
     * Render the subtree at the given address.
     */
    String render(FlatStore store, long root);

    /**
     * Render the subtree at the given address into a caller supplied sink.
     * Output written before a failure is not guaranteed to be a valid prefix.
     */
    void renderTo(FlatStore store, long root, Appendable out);

    /**
     * Human-readable structural trace of the subtree at the given address, for builder debugging.
     * The format is not stable.
     */
    String dump(FlatStore store, long address, int indent);
}
