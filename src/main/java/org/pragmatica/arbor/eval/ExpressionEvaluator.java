package org.pragmatica.arbor.eval;

import org.pragmatica.arbor.error.DivisionByZeroException;
import org.pragmatica.arbor.error.EvaluationException;
import org.pragmatica.arbor.error.TreeError;
import org.pragmatica.arbor.expr.Expression;
import org.pragmatica.arbor.expr.ExpressionVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;
import java.util.function.LongSupplier;

/**
 * Reduces an expression tree to a number.
 *
 * <p>Results are {@link Long} while every operand is integral and {@link Double} as soon as a
 * {@link Expression.Float} takes part. {@link Expression.Divide} always divides in floating point.
 * Integer arithmetic is exact: overflow fails instead of wrapping. Floating-point results that
 * overflow to infinity or become NaN fail as well.
 */
public final class ExpressionEvaluator implements ExpressionVisitor<Number> {
    private static final Logger LOG = LoggerFactory.getLogger(ExpressionEvaluator.class);

    public static final ExpressionEvaluator INSTANCE = new ExpressionEvaluator();

    private static final String NEGATIVE = "Negative";

    private ExpressionEvaluator() {}

    /**
     * Evaluate the tree rooted at {@code root}.
     *
     * @throws DivisionByZeroException if a divisor evaluates to zero
     * @throws EvaluationException     if integer arithmetic overflows or a floating-point result is not finite
     */
    public Number evaluate(Expression root) {
        var result = root.accept(this);
        LOG.debug("Evaluated expression to {}", result);
        return result;
    }

    @Override
    public Number visitInteger(Expression.Integer integer) {
        return integer.value();
    }

    @Override
    public Number visitFloat(Expression.Float floating) {
        return floating.value();
    }

    @Override
    public Number visitNegative(Expression.Negative negative) {
        var value = negative.operand()
                            .accept(this);
        if (value instanceof Long) {
            return exact(negative, NEGATIVE, () -> Math.negateExact(value.longValue()));
        }
        return -value.doubleValue();
    }

    @Override
    public Number visitAdd(Expression.Add add) {
        return arithmetic(add, Math::addExact, Double::sum);
    }

    @Override
    public Number visitSubtract(Expression.Subtract subtract) {
        return arithmetic(subtract, Math::subtractExact, (l, r) -> l - r);
    }

    @Override
    public Number visitMultiply(Expression.Multiply multiply) {
        return arithmetic(multiply, Math::multiplyExact, (l, r) -> l * r);
    }

    @Override
    public Number visitDivide(Expression.Divide divide) {
        var dividend = divide.left()
                             .accept(this);
        var divisor = divide.right()
                            .accept(this);
        if (divisor.doubleValue() == 0.0) {
            LOG.debug("Divisor of Divide evaluated to zero");
            throw new DivisionByZeroException(divide);
        }
        return finite(divide, dividend.doubleValue() / divisor.doubleValue());
    }

    private Number arithmetic(Expression.Binary node, LongBinaryOperator integral, DoubleBinaryOperator floating) {
        var left = node.left()
                       .accept(this);
        var right = node.right()
                        .accept(this);
        if (left instanceof Long && right instanceof Long) {
            return exact(node, label(node), () -> integral.applyAsLong(left.longValue(), right.longValue()));
        }
        return finite(node, floating.applyAsDouble(left.doubleValue(), right.doubleValue()));
    }

    private static Long exact(Expression node, String operation, LongSupplier supplier) {
        try {
            return supplier.getAsLong();
        } catch (ArithmeticException e) {
            throw new EvaluationException(new TreeError.IntegerOverflow(operation, node), e);
        }
    }

    private static Double finite(Expression.Binary node, double result) {
        if (!Double.isFinite(result)) {
            throw new EvaluationException(new TreeError.NonFiniteResult(label(node), node));
        }
        return result;
    }

    private static String label(Expression.Binary node) {
        return node.operator()
                   .label();
    }
}
