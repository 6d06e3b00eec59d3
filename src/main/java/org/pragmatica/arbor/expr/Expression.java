package org.pragmatica.arbor.expr;

import org.pragmatica.arbor.error.ConstructionException;
import org.pragmatica.arbor.error.TreeError;

import java.math.BigDecimal;

/**
 * Immutable arithmetic expression tree.
 *
 * <p>Example:
 * <pre>{@code
 * var expr = Expression.add(Expression.integer(2),
 *                           Expression.divide(Expression.multiply(Expression.floating(5.0),
 *                                                                 Expression.negative(Expression.integer(3))),
 *                                             Expression.floating(10.0)));
 * }</pre>
 */
public sealed interface Expression {

    /**
     * Dispatch to the visitor handler for this variant.
     */
    <R> R accept(ExpressionVisitor<R> visitor);

    static Integer integer(long value) {
        return new Integer(value);
    }

    static Float floating(double value) {
        return new Float(value);
    }

    static Negative negative(Expression operand) {
        return new Negative(operand);
    }

    static Add add(Expression left, Expression right) {
        return new Add(left, right);
    }

    static Subtract subtract(Expression left, Expression right) {
        return new Subtract(left, right);
    }

    static Multiply multiply(Expression left, Expression right) {
        return new Multiply(left, right);
    }

    static Divide divide(Expression left, Expression right) {
        return new Divide(left, right);
    }

    private static void requireOperand(Expression operand, String variant, String side) {
        if (operand == null) {
            throw new ConstructionException(new TreeError.MissingOperand(variant, side));
        }
    }

    // === Values ===

    /**
     * Integral literal.
     */
    record Integer(long value) implements Expression {
        /**
         * Create from a boxed number. Non-finite, fractional and out-of-range values are rejected.
         */
        public static Integer of(Number value) {
            if (value == null) {
                throw new ConstructionException(new TreeError.NonFiniteValue("Integer", null));
            }
            BigDecimal decimal;
            try {
                decimal = new BigDecimal(value.toString());
            } catch (NumberFormatException e) {
                throw new ConstructionException(new TreeError.NonFiniteValue("Integer", value), e);
            }
            if (decimal.stripTrailingZeros()
                       .scale() > 0) {
                throw new ConstructionException(new TreeError.NotIntegral(value));
            }
            try {
                return new Integer(decimal.longValueExact());
            } catch (ArithmeticException e) {
                throw new ConstructionException(new TreeError.OutOfRange(value), e);
            }
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitInteger(this);
        }
    }

    /**
     * Floating-point literal. Must be finite.
     */
    record Float(double value) implements Expression {
        public Float {
            if (!Double.isFinite(value)) {
                throw new ConstructionException(new TreeError.NonFiniteValue("Float", value));
            }
        }

        /**
         * Create from a boxed number.
         */
        public static Float of(Number value) {
            if (value == null) {
                throw new ConstructionException(new TreeError.NonFiniteValue("Float", null));
            }
            return new Float(value.doubleValue());
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitFloat(this);
        }
    }

    // === Unary ===

    /**
     * Arithmetic negation.
     */
    record Negative(Expression operand) implements Expression {
        public Negative {
            requireOperand(operand, "Negative", "an");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitNegative(this);
        }
    }

    // === Binary ===

    /**
     * Operation with two operands.
     */
    sealed interface Binary extends Expression {
        Expression left();

        Expression right();

        Operator operator();
    }

    record Add(Expression left, Expression right) implements Binary {
        public Add {
            requireOperand(left, "Add", "a left");
            requireOperand(right, "Add", "a right");
        }

        @Override
        public Operator operator() {
            return Operator.ADD;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitAdd(this);
        }
    }

    record Subtract(Expression left, Expression right) implements Binary {
        public Subtract {
            requireOperand(left, "Subtract", "a left");
            requireOperand(right, "Subtract", "a right");
        }

        @Override
        public Operator operator() {
            return Operator.SUBTRACT;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitSubtract(this);
        }
    }

    record Multiply(Expression left, Expression right) implements Binary {
        public Multiply {
            requireOperand(left, "Multiply", "a left");
            requireOperand(right, "Multiply", "a right");
        }

        @Override
        public Operator operator() {
            return Operator.MULTIPLY;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitMultiply(this);
        }
    }

    /**
     * Division. Always evaluated in floating point.
     */
    record Divide(Expression left, Expression right) implements Binary {
        public Divide {
            requireOperand(left, "Divide", "a left");
            requireOperand(right, "Divide", "a right");
        }

        @Override
        public Operator operator() {
            return Operator.DIVIDE;
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitDivide(this);
        }
    }
}
