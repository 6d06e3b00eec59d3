package org.pragmatica.arbor.error;

/**
 * Raised when an expression tree cannot be reduced to a number.
 */
public class EvaluationException extends TreeException {
    public EvaluationException(TreeError error) {
        super(error);
    }

    public EvaluationException(TreeError error, Throwable cause) {
        super(error, cause);
    }
}
