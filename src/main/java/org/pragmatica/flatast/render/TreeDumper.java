package org.pragmatica.flatast.render;

import org.pragmatica.flatast.error.FlatAstException;
import org.pragmatica.flatast.error.TreeError;
import org.pragmatica.flatast.tree.Address;
import org.pragmatica.flatast.tree.FlatStore;
import org.pragmatica.flatast.tree.Node;

/**
 * Structural trace of a subtree, one line per record, for debugging tree builders.
 *
 * <p>Every run is followed by a {@code [-]} line for the absent key that ends it.
 */
public final class TreeDumper {
    private static final int MAX_PAD = 50;

    private final RenderConfig config;

    private TreeDumper(RenderConfig config) {
        this.config = config;
    }

    public static TreeDumper create(RenderConfig config) {
        return new TreeDumper(config);
    }

    public String dump(FlatStore store, long address, int indent) {
        var out = new StringBuilder();
        dump(store, address, Math.max(indent, 0), 0, out);
        return out.toString();
    }

    private boolean dump(FlatStore store, long address, int pad, int depth, StringBuilder out) {
        var node = store.get(address);
        // The terminator of a run is not a record and never counts against the limit
        if (node.isPresent() && depth > config.maxDepth()) {
            throw new FlatAstException(new TreeError.TooDeeplyNested(address, config.maxDepth()));
        }
        out.append(" ".repeat(Math.min(pad, MAX_PAD)));
        if (node.isEmpty()) {
            out.append("[-]\n");
            return false;
        }
        var record = node.get();
        if (record instanceof Node.Structural structural) {
            out.append(" [")
               .append(structural.category().displayName())
               .append(' ')
               .append(structural.variant())
               .append(' ')
               .append(structural.slots())
               .append("]\n");
        } else if (record instanceof Node.Leaf leaf) {
            out.append(" [string ")
               .append(leaf.text())
               .append("]\n");
        } else {
            out.append(" [nil]\n");
        }
        var index = 0;
        while (dump(store, Address.child(address, index), pad + 1, depth + 1, out)) {
            index++;
        }
        return true;
    }
}
