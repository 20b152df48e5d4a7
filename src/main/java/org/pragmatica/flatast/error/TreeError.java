package org.pragmatica.flatast.error;

import org.pragmatica.flatast.tree.Address;

/**
 * Failure while building or rendering a flat tree, with the address it concerns.
 */
public sealed interface TreeError {
    long address();

    String message();

    /**
     * A second record was written to an occupied address.
     */
    record AddressCollision(long address) implements TreeError {
        @Override
        public String message() {
            return "Address " + Address.format(address) + " is already occupied";
        }
    }

    /**
     * The key right after a child run is occupied by an unrelated record, which would extend the run.
     */
    record RunOverlap(long parent, int runLength, long address) implements TreeError {
        @Override
        public String message() {
            return "Run of " + runLength + " children under " + Address.format(parent)
                   + " is continued by an unrelated record at " + Address.format(address);
        }
    }

    /**
     * A grammar-mandated child is absent.
     */
    record MissingChild(long parent, int index, String expected) implements TreeError {
        @Override
        public long address() {
            return parent;
        }

        @Override
        public String message() {
            return "Malformed node at " + Address.format(parent) + ": child " + index + " (" + expected + ") is absent";
        }
    }

    /**
     * Nesting exceeds the configured depth ceiling.
     */
    record TooDeeplyNested(long address, int limit) implements TreeError {
        @Override
        public String message() {
            return "Tree too deeply nested at " + Address.format(address) + ", limit is " + limit;
        }
    }
}
