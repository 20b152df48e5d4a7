package org.pragmatica.flatast.tree;

import org.pragmatica.flatast.grammar.Variant;

import java.util.Optional;

/**
 * Allocation-free encoding of a structural node's {category, variant, slots} triple
 * into a single {@code long}.
 *
 * <p>Layout: category code in bits 56-63, logical length ({@code variant + 1}) in
 * bits 40-55, logical capacity ({@code baseline + slots}, or the length for
 * categories without a slot axis) in bits 0-39. The value {@link #NONE} marks a
 * record that is not structural (leaf, explicit-empty or absent).
 */
public final class NodeTag {
    public static final long NONE = 0L;

    private static final int CATEGORY_SHIFT = 56;
    private static final int LENGTH_SHIFT = 40;
    private static final long LENGTH_MASK = 0xFFFFL;
    private static final long CAPACITY_MASK = (1L << LENGTH_SHIFT) - 1;

    private NodeTag() {}

    /**
     * Build a tag. An out-of-range variant or slot count is a programmer error of the tree builder.
     */
    public static long make(Category category, int variant, int slots) {
        if (variant < 0 || variant >= category.variantCount()) {
            throw new IllegalArgumentException(
            "Variant " + variant + " out of range for " + category.displayName());
        }
        if (slots < 0) {
            throw new IllegalArgumentException("Negative slot count " + slots + " for " + category.displayName());
        }
        if (slots != 0 && !category.hasSlots()) {
            throw new IllegalArgumentException(category.displayName() + " has no slot axis");
        }
        long length = variant + 1L;
        long capacity = category.hasSlots()
            ? (long) category.baseline() + slots
            : length;
        return ((long) category.code() << CATEGORY_SHIFT) | (length << LENGTH_SHIFT) | capacity;
    }

    public static long of(Variant variant) {
        return make(variant.category(), variant.code(), 0);
    }

    public static long of(Variant variant, int slots) {
        return make(variant.category(), variant.code(), slots);
    }

    public static long of(Category category) {
        return make(category, 0, 0);
    }

    public static long of(Category category, int slots) {
        return make(category, 0, slots);
    }

    public static boolean isStructural(long tag) {
        return (tag >>> CATEGORY_SHIFT) != 0;
    }

    /**
     * Category of a tag, empty for leaves, explicit-empty and absent records.
     */
    public static Optional<Category> categoryOf(long tag) {
        return isStructural(tag)
            ? Optional.of(category(tag))
            : Optional.empty();
    }

    /**
     * Category of a structural tag.
     */
    public static Category category(long tag) {
        var code = (int) (tag >>> CATEGORY_SHIFT);
        if (code == 0 || code > Category.codeLimit()) {
            throw new IllegalArgumentException("Not a structural tag: " + Long.toHexString(tag));
        }
        return Category.fromCode(code);
    }

    public static boolean is(long tag, Category category) {
        return (tag >>> CATEGORY_SHIFT) == category.code();
    }

    public static boolean is(long tag, Variant variant) {
        return is(tag, variant.category()) && variantOf(tag) == variant.code();
    }

    public static int variantOf(long tag) {
        return (int) length(tag) - 1;
    }

    public static int slotsOf(long tag) {
        var category = category(tag);
        if (!category.hasSlots()) {
            return 0;
        }
        return (int) (capacity(tag) - category.baseline());
    }

    static long length(long tag) {
        return (tag >>> LENGTH_SHIFT) & LENGTH_MASK;
    }

    static long capacity(long tag) {
        return tag & CAPACITY_MASK;
    }

    public static String describe(long tag) {
        if (!isStructural(tag)) {
            return "<none>";
        }
        return category(tag).displayName() + " " + variantOf(tag) + " " + slotsOf(tag);
    }
}
