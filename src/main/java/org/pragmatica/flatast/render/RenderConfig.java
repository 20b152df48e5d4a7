package org.pragmatica.flatast.render;

/**
 * Renderer configuration options.
 *
 * @param maxDepth       deepest nesting rendered before failing with a "too deeply nested" error
 * @param omissionPolicy handling of absent grammar-mandated children
 */
public record RenderConfig(
    int maxDepth,
    OmissionPolicy omissionPolicy
) {
    public static final RenderConfig DEFAULT = new RenderConfig(
        512,
        OmissionPolicy.LENIENT
    );

    public RenderConfig {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Depth limit must be positive, got " + maxDepth);
        }
        if (omissionPolicy == null) {
            throw new IllegalArgumentException("Omission policy must be set");
        }
    }
}
