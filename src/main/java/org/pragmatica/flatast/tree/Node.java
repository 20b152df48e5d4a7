package org.pragmatica.flatast.tree;

import org.pragmatica.flatast.grammar.Variant;

/**
 * Record stored at a present address of a {@link FlatStore}.
 * An absent address has no record at all and ends a child run.
 */
public sealed interface Node {
    /**
     * Raw text: identifier, literal, struct tag or comment text.
     */
    record Leaf(String text) implements Node {}

    /**
     * Structurally present but content-free, e.g. an intentionally omitted slice bound.
     * Continues a child run, unlike an absent key.
     */
    record Empty() implements Node {
        static final Empty INSTANCE = new Empty();
    }

    /**
     * Interior node identified by its packed tag.
     */
    record Structural(long tag) implements Node {
        public Category category() {
            return NodeTag.category(tag);
        }

        public int variant() {
            return NodeTag.variantOf(tag);
        }

        public int slots() {
            return NodeTag.slotsOf(tag);
        }

        public boolean is(Variant kind) {
            return NodeTag.is(tag, kind);
        }

        @Override
        public String toString() {
            return "Structural[" + NodeTag.describe(tag) + "]";
        }
    }
}
