package org.pragmatica.flatast.tree;

import it.unimi.dsi.fastutil.longs.Long2IntMap;

import java.util.Optional;

/**
 * Immutable mapping from 64-bit addresses to node records; the only structure
 * representing a whole syntax tree.
 *
 * <p>Records live in an arena: an index from address to slot, and parallel tag and
 * text arrays sized by the node count. A slot with a structural tag is a
 * structural node, a slot with {@link NodeTag#NONE} and text is a leaf, and a slot
 * with neither is explicit-empty. Instances are created by {@link TreeBuilder}.
 */
public final class FlatStore {
    private final Long2IntMap index;
    private final long[] tags;
    private final String[] texts;

    FlatStore(Long2IntMap index, long[] tags, String[] texts) {
        this.index = index;
        this.tags = tags;
        this.texts = texts;
    }

    /**
     * Number of present records.
     */
    public int size() {
        return index.size();
    }

    public boolean present(long address) {
        return index.containsKey(address);
    }

    /**
     * Record at the address, empty when the address is absent.
     */
    public Optional<Node> get(long address) {
        var slot = index.get(address);
        if (slot < 0) {
            return Optional.empty();
        }
        if (tags[slot] != NodeTag.NONE) {
            return Optional.of(new Node.Structural(tags[slot]));
        }
        var text = texts[slot];
        return Optional.of(text == null
            ? Node.Empty.INSTANCE
            : new Node.Leaf(text));
    }

    /**
     * Tag of a structural record, {@link NodeTag#NONE} for anything else.
     */
    public long tag(long address) {
        var slot = index.get(address);
        return slot < 0
            ? NodeTag.NONE
            : tags[slot];
    }

    /**
     * Text of a leaf record, empty string for anything else.
     */
    public String text(long address) {
        var slot = index.get(address);
        if (slot < 0 || texts[slot] == null) {
            return "";
        }
        return texts[slot];
    }

    public boolean isLeaf(long address) {
        var slot = index.get(address);
        return slot >= 0 && texts[slot] != null;
    }

    public boolean isStructural(long address) {
        return NodeTag.isStructural(tag(address));
    }

    public boolean isExplicitEmpty(long address) {
        var slot = index.get(address);
        return slot >= 0 && tags[slot] == NodeTag.NONE && texts[slot] == null;
    }

    /**
     * True for absent and explicit-empty addresses.
     */
    public boolean isNil(long address) {
        var slot = index.get(address);
        return slot < 0 || (tags[slot] == NodeTag.NONE && texts[slot] == null);
    }

    /**
     * Number of children of the node at {@code parent}: present keys from its base up to the first absent key.
     */
    public int runLength(long parent) {
        var base = Address.base(parent);
        var count = 0;
        while (index.containsKey(base + count)) {
            count++;
        }
        return count;
    }
}
