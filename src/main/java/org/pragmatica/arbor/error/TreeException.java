package org.pragmatica.arbor.error;

/**
 * Base of all failures raised by tree construction and traversal.
 * The concrete cause is available through {@link #error()}.
 */
public abstract class TreeException extends RuntimeException {
    private final TreeError error;

    protected TreeException(TreeError error) {
        super(error.message());
        this.error = error;
    }

    protected TreeException(TreeError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public TreeError error() {
        return error;
    }
}
