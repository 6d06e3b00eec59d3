package org.pragmatica.arbor.error;

import org.pragmatica.arbor.expr.Expression;

/**
 * Raised when the right operand of a {@link Expression.Divide} evaluates to zero.
 */
public final class DivisionByZeroException extends EvaluationException {
    private final Expression.Divide node;

    public DivisionByZeroException(Expression.Divide node) {
        super(new TreeError.DivisionByZero(node));
        this.node = node;
    }

    /**
     * The division whose divisor evaluated to zero.
     */
    public Expression.Divide node() {
        return node;
    }
}
