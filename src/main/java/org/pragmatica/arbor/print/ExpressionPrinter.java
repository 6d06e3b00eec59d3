package org.pragmatica.arbor.print;

import org.pragmatica.arbor.expr.Expression;
import org.pragmatica.arbor.expr.ExpressionVisitor;

/**
 * Renders an expression tree in infix form.
 *
 * <p>Every operand that is itself a binary operation is parenthesised, whatever the precedence,
 * so the printed text always preserves the tree's grouping. The root is never wrapped.
 * <pre>{@code
 * Add(Integer(2), Divide(Multiply(Float(5.0), Negative(Integer(3))), Float(10.0)))
 *   -> 2 + ((5.0 * -3) / 10.0)
 * }</pre>
 */
public final class ExpressionPrinter implements ExpressionVisitor<String> {
    public static final ExpressionPrinter INSTANCE = new ExpressionPrinter();

    private ExpressionPrinter() {}

    public String print(Expression root) {
        return root.accept(this);
    }

    @Override
    public String visitInteger(Expression.Integer integer) {
        return Literals.integer(integer.value());
    }

    @Override
    public String visitFloat(Expression.Float floating) {
        return Literals.floating(floating.value());
    }

    @Override
    public String visitNegative(Expression.Negative negative) {
        return "-" + operand(negative.operand());
    }

    @Override
    public String visitAdd(Expression.Add add) {
        return binary(add);
    }

    @Override
    public String visitSubtract(Expression.Subtract subtract) {
        return binary(subtract);
    }

    @Override
    public String visitMultiply(Expression.Multiply multiply) {
        return binary(multiply);
    }

    @Override
    public String visitDivide(Expression.Divide divide) {
        return binary(divide);
    }

    private String binary(Expression.Binary binary) {
        var symbol = binary.operator()
                           .symbol();
        return operand(binary.left()) + " " + symbol + " " + operand(binary.right());
    }

    private String operand(Expression operand) {
        var text = operand.accept(this);
        return operand instanceof Expression.Binary
               ? "(" + text + ")"
               : text;
    }
}
