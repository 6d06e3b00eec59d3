package org.pragmatica.arbor.error;

import org.pragmatica.arbor.expr.Expression;

/**
 * Failure causes for tree construction and evaluation.
 */
public sealed interface TreeError {
    String message();

    /**
     * Internal node constructed without children.
     */
    record EmptyChildren(String name) implements TreeError {
        @Override
        public String message() {
            return "Node '" + name + "' must have at least one child, use a leaf instead";
        }
    }

    /**
     * Leaf or node constructed without a name.
     */
    record MissingName(String variant) implements TreeError {
        @Override
        public String message() {
            return variant + " requires a name";
        }
    }

    /**
     * Internal node constructed with an absent child.
     */
    record MissingChild(String name, int index) implements TreeError {
        @Override
        public String message() {
            return "Node '" + name + "' has no child at position " + index;
        }
    }

    /**
     * Expression node constructed with an absent operand.
     */
    record MissingOperand(String variant, String operand) implements TreeError {
        @Override
        public String message() {
            return variant + " requires " + operand + " operand";
        }
    }

    /**
     * Value leaf constructed from an absent or non-finite number.
     */
    record NonFiniteValue(String variant, Object value) implements TreeError {
        @Override
        public String message() {
            return variant + " requires a finite number, got " + value;
        }
    }

    /**
     * Integer leaf constructed from a number with a fractional part.
     */
    record NotIntegral(Number value) implements TreeError {
        @Override
        public String message() {
            return "Integer requires an integral value, got " + value;
        }
    }

    /**
     * Integer leaf constructed from a number outside the range of {@code long}.
     */
    record OutOfRange(Number value) implements TreeError {
        @Override
        public String message() {
            return "Integer requires a value within the range of long, got " + value;
        }
    }

    /**
     * Right operand of a division evaluated to zero.
     */
    record DivisionByZero(Expression.Divide node) implements TreeError {
        @Override
        public String message() {
            return "Division by zero: divisor of Divide evaluated to 0";
        }
    }

    /**
     * Integer arithmetic exceeded the range of {@code long}.
     */
    record IntegerOverflow(String operation, Expression node) implements TreeError {
        @Override
        public String message() {
            return "Integer overflow in " + operation;
        }
    }

    /**
     * Floating-point arithmetic produced an infinite or NaN result.
     */
    record NonFiniteResult(String operation, Expression node) implements TreeError {
        @Override
        public String message() {
            return "Non-finite result in " + operation;
        }
    }
}
