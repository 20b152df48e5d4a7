package org.pragmatica.flatast.error;

/**
 * Unchecked carrier of a {@link TreeError}.
 */
public final class FlatAstException extends RuntimeException {
    private final TreeError error;

    public FlatAstException(TreeError error) {
        super(error.message());
        this.error = error;
    }

    public TreeError error() {
        return error;
    }
}
