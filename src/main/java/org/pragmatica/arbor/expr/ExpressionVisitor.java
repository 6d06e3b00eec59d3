package org.pragmatica.arbor.expr;

/**
 * Operation over expression trees. Implementations recurse by calling
 * {@link Expression#accept(ExpressionVisitor)} on operands.
 *
 * @param <R> result of visiting a node
 */
public interface ExpressionVisitor<R> {
    R visitInteger(Expression.Integer integer);

    R visitFloat(Expression.Float floating);

    R visitNegative(Expression.Negative negative);

    R visitAdd(Expression.Add add);

    R visitSubtract(Expression.Subtract subtract);

    R visitMultiply(Expression.Multiply multiply);

    R visitDivide(Expression.Divide divide);
}
