package org.pragmatica.flatast.render;

/**
 * What the renderer does when a grammar-mandated child is absent.
 */
public enum OmissionPolicy {
    /**
     * Render nothing for the missing piece and continue.
     */
    LENIENT,

    /**
     * Fail with a malformed node error before emitting the node.
     */
    STRICT
}
