package org.pragmatica.flatast.tree;

/**
 * Address function of the flat store.
 *
 * <p>A node never references its children. The first child of the node at
 * address {@code a} lives at {@code base(a)}, the next ones at
 * {@code base(a) + 1}, {@code base(a) + 2} and so on until the first absent key.
 * Addresses are 64-bit keys compared as unsigned values; arithmetic wraps.
 */
public final class Address {
    /**
     * Address of the root node of every tree.
     */
    public static final long ROOT = 0L;

    private Address() {}

    /**
     * Avalanche-mixing one way function from a node address to the base address of its child run.
     * Every output bit depends on every input bit, so runs of unrelated nodes practically never meet.
     */
    public static long scramble(long address) {
        var v = address * 3935559000370003845L + 2691343689449507681L;
        v ^= v >>> 21;
        v ^= v << 37;
        v ^= v >>> 4;
        v *= 4768777513237032717L;
        v ^= v << 20;
        v ^= v >>> 41;
        v ^= v << 5;
        return v;
    }

    /**
     * Address of the first child of the node at {@code address}.
     */
    public static long base(long address) {
        return scramble(address);
    }

    /**
     * Address of child {@code index} of the node at {@code address}.
     */
    public static long child(long address, long index) {
        return scramble(address) + index;
    }

    public static String format(long address) {
        return "0x" + Long.toHexString(address);
    }
}
