package org.pragmatica.arbor;

import org.pragmatica.arbor.eval.ExpressionEvaluator;
import org.pragmatica.arbor.expr.Expression;
import org.pragmatica.arbor.print.ExpressionOutline;
import org.pragmatica.arbor.print.ExpressionPrinter;
import org.pragmatica.arbor.print.PrinterConfig;
import org.pragmatica.arbor.print.TreePrinter;
import org.pragmatica.arbor.print.TreeStyle;
import org.pragmatica.arbor.tree.TreeNode;

import java.util.Objects;

/**
 * Entry point for printing and evaluating trees.
 *
 * <p>Example usage:
 * <pre>{@code
 * var scene = TreeNode.node("Scene", TreeNode.node("Table", TreeNode.leaf("Box")));
 * var diagram = Arbor.printTree(scene);
 *
 * var expr = Expression.add(Expression.integer(2), Expression.floating(0.5));
 * var text = Arbor.printExpression(expr);   // "2 + 0.5"
 * var value = Arbor.evaluate(expr);         // 2.5
 * }</pre>
 */
public final class Arbor {
    private static final TreePrinter DEFAULT_PRINTER = TreePrinter.create();

    private Arbor() {}

    /**
     * Render a generic tree as a folder diagram.
     */
    public static String printTree(TreeNode root) {
        return DEFAULT_PRINTER.print(root);
    }

    /**
     * Render a generic tree in the given style.
     */
    public static String printTree(TreeNode root, TreeStyle style) {
        return TreePrinter.create(PrinterConfig.DEFAULT.withStyle(style))
                          .print(root);
    }

    /**
     * Render the structure of an expression as a folder diagram.
     */
    public static String printTree(Expression root) {
        return printTree(ExpressionOutline.INSTANCE.outline(root));
    }

    /**
     * Render the structure of an expression in the given style.
     */
    public static String printTree(Expression root, TreeStyle style) {
        return printTree(ExpressionOutline.INSTANCE.outline(root), style);
    }

    /**
     * Render an expression in infix form.
     */
    public static String printExpression(Expression root) {
        return ExpressionPrinter.INSTANCE.print(root);
    }

    /**
     * Reduce an expression to a number: {@link Long} for purely integral arithmetic, {@link Double} otherwise.
     *
     * @throws org.pragmatica.arbor.error.DivisionByZeroException if a divisor evaluates to zero
     */
    public static Number evaluate(Expression root) {
        return ExpressionEvaluator.INSTANCE.evaluate(root);
    }

    /**
     * Create a builder for a configured tree printer.
     */
    public static Builder printer() {
        return new Builder();
    }

    public static final class Builder {
        private TreeStyle style = TreeStyle.TREE;
        private String lineSeparator = "\n";

        private Builder() {}

        public Builder style(TreeStyle style) {
            this.style = Objects.requireNonNull(style, "style");
            return this;
        }

        public Builder lineSeparator(String lineSeparator) {
            this.lineSeparator = Objects.requireNonNull(lineSeparator, "lineSeparator");
            return this;
        }

        public TreePrinter build() {
            return TreePrinter.create(new PrinterConfig(style, lineSeparator));
        }
    }
}
