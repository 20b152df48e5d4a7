package org.pragmatica.flatast;

import org.pragmatica.flatast.render.CodeRenderer;
import org.pragmatica.flatast.render.OmissionPolicy;
import org.pragmatica.flatast.render.RenderConfig;
import org.pragmatica.flatast.render.Renderer;
import org.pragmatica.flatast.tree.FlatStore;
import org.pragmatica.flatast.trivia.CommentClassifier;
import org.pragmatica.flatast.trivia.CommentPlacement;

/**
 * Entry point for rendering flat syntax trees.
 *
 * <p>Example usage:
 * <pre>{@code
 * var placement = FlatAst.classifyComments(sourceBytes);
 * var store = builder.build();   // TreeBuilder populated by a front-end walk
 *
 * var text = FlatAst.render(store);
 * }</pre>
 */
public final class FlatAst {
    private static final Renderer DEFAULT_RENDERER = CodeRenderer.create(RenderConfig.DEFAULT);

    private FlatAst() {}

    /**
     * Render the whole tree with the default configuration.
     */
    public static String render(FlatStore store) {
        return DEFAULT_RENDERER.render(store);
    }

    /**
     * Render the subtree at the given address with the default configuration.
     */
    public static String render(FlatStore store, long root) {
        return DEFAULT_RENDERER.render(store, root);
    }

    public static String dump(FlatStore store, long address, int indent) {
        return DEFAULT_RENDERER.dump(store, address, indent);
    }

    /**
     * Classify comment placement of raw source bytes, for use while building comment nodes.
     */
    public static CommentPlacement classifyComments(byte[] source) {
        return CommentClassifier.classify(source);
    }

    public static CommentPlacement classifyComments(String source) {
        return CommentClassifier.classify(source);
    }

    /**
     * Create a builder for a renderer with non-default configuration.
     */
    public static Builder renderer() {
        return new Builder();
    }

    public static final class Builder {
        private int maxDepth = RenderConfig.DEFAULT.maxDepth();
        private OmissionPolicy omissionPolicy = RenderConfig.DEFAULT.omissionPolicy();

        private Builder() {}

        public Builder maxDepth(int depth) {
            this.maxDepth = depth;
            return this;
        }

        public Builder omissions(OmissionPolicy policy) {
            this.omissionPolicy = policy;
            return this;
        }

        public Renderer build() {
            return CodeRenderer.create(new RenderConfig(maxDepth, omissionPolicy));
        }
    }
}
