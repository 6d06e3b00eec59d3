package org.pragmatica.arbor.error;

/**
 * Raised synchronously when a node is built from invalid parts.
 */
public final class ConstructionException extends TreeException {
    public ConstructionException(TreeError error) {
        super(error);
    }

    public ConstructionException(TreeError error, Throwable cause) {
        super(error, cause);
    }
}
