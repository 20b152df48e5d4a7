package org.pragmatica.flatast.tree;

import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import org.pragmatica.flatast.error.FlatAstException;
import org.pragmatica.flatast.error.TreeError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.function.Consumer;

/**
 * Write-once construction of a {@link FlatStore}.
 *
 * <p>Records are placed either at explicit addresses ({@link #put}, {@link #putLeaf},
 * {@link #putEmpty}) or appended to the child run of a node through a {@link Cursor}.
 * Writing an occupied address fails with {@link TreeError.AddressCollision}; at
 * {@link #build()} every run appended through a cursor is checked to end at an
 * absent key, failing with {@link TreeError.RunOverlap} otherwise.
 *
 * <p>Example:
 * <pre>{@code
 * var builder = TreeBuilder.create();
 * builder.root(NodeTag.of(Category.ROOT_MATTER))
 *        .node(NodeTag.of(Category.FILE_MATTER))
 *        .node(NodeTag.of(Variant.Package.NORMAL), pkg -> pkg.leaf("main"));
 * var store = builder.build();
 * }</pre>
 */
public final class TreeBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(TreeBuilder.class);
    private static final int DEFAULT_CAPACITY = 64;

    private final Long2IntMap index;
    private final Long2IntMap runs;
    private long[] tags;
    private String[] texts;
    private int size;
    private boolean built;

    private TreeBuilder(int expectedNodes) {
        this.index = new Long2IntOpenHashMap(expectedNodes);
        this.index.defaultReturnValue(-1);
        this.runs = new Long2IntOpenHashMap();
        this.tags = new long[expectedNodes];
        this.texts = new String[expectedNodes];
    }

    public static TreeBuilder create() {
        return new TreeBuilder(DEFAULT_CAPACITY);
    }

    public static TreeBuilder create(int expectedNodes) {
        return new TreeBuilder(Math.max(expectedNodes, 1));
    }

    /**
     * Place a structural root node at {@link Address#ROOT}.
     */
    public Cursor root(long tag) {
        return at(Address.ROOT, tag);
    }

    /**
     * Place a structural node at an explicit address and return a cursor appending to its run.
     */
    public Cursor at(long address, long tag) {
        put(address, tag);
        return new Cursor(address);
    }

    public TreeBuilder put(long address, long tag) {
        if (!NodeTag.isStructural(tag)) {
            throw new IllegalArgumentException("Not a structural tag: " + Long.toHexString(tag));
        }
        store(address, tag, null);
        return this;
    }

    public TreeBuilder putLeaf(long address, String text) {
        if (text == null) {
            throw new IllegalArgumentException("Leaf text must not be null");
        }
        store(address, NodeTag.NONE, text);
        return this;
    }

    public TreeBuilder putEmpty(long address) {
        store(address, NodeTag.NONE, null);
        return this;
    }

    /**
     * Finish construction. The builder cannot be used afterwards.
     */
    public FlatStore build() {
        ensureOpen();
        for (var entry : runs.long2IntEntrySet()) {
            var parent = entry.getLongKey();
            var length = entry.getIntValue();
            var next = Address.child(parent, length);
            if (index.containsKey(next)) {
                throw new FlatAstException(new TreeError.RunOverlap(parent, length, next));
            }
        }
        built = true;
        LOGGER.debug("Built flat store with {} records", size);
        return new FlatStore(index, Arrays.copyOf(tags, size), Arrays.copyOf(texts, size));
    }

    private void store(long address, long tag, String text) {
        ensureOpen();
        if (index.containsKey(address)) {
            throw new FlatAstException(new TreeError.AddressCollision(address));
        }
        if (size == tags.length) {
            var capacity = tags.length * 2;
            tags = Arrays.copyOf(tags, capacity);
            texts = Arrays.copyOf(texts, capacity);
        }
        tags[size] = tag;
        texts[size] = text;
        index.put(address, size);
        size++;
    }

    private long nextChild(long parent) {
        var count = runs.get(parent);
        runs.put(parent, count + 1);
        return Address.child(parent, count);
    }

    private void ensureOpen() {
        if (built) {
            throw new IllegalStateException("Tree already built");
        }
    }

    /**
     * Appends children to the run of one structural node.
     */
    public final class Cursor {
        private final long address;

        private Cursor(long address) {
            this.address = address;
            runs.putIfAbsent(address, 0);
        }

        public long address() {
            return address;
        }

        /**
         * Number of children appended so far.
         */
        public int childCount() {
            return runs.get(address);
        }

        /**
         * Append a structural child and return its cursor.
         */
        public Cursor node(long tag) {
            var child = nextChild(address);
            put(child, tag);
            return new Cursor(child);
        }

        /**
         * Append a structural child, populate it and return this cursor.
         */
        public Cursor node(long tag, Consumer<Cursor> children) {
            children.accept(node(tag));
            return this;
        }

        public Cursor leaf(String text) {
            putLeaf(nextChild(address), text);
            return this;
        }

        public Cursor empty() {
            putEmpty(nextChild(address));
            return this;
        }
    }
}
