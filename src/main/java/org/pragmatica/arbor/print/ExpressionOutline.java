package org.pragmatica.arbor.print;

import org.pragmatica.arbor.expr.Expression;
import org.pragmatica.arbor.expr.ExpressionVisitor;
import org.pragmatica.arbor.tree.TreeNode;

/**
 * Converts an expression into a labeled tree, so it can be drawn by {@link TreePrinter}.
 * Values become leaves such as {@code Integer(2)} or {@code Float(5.0)}; operations become
 * nodes named after their variant, with operands as children in order.
 */
public final class ExpressionOutline implements ExpressionVisitor<TreeNode> {
    public static final ExpressionOutline INSTANCE = new ExpressionOutline();

    private static final String NEGATIVE = "Negative";

    private ExpressionOutline() {}

    public TreeNode outline(Expression root) {
        return root.accept(this);
    }

    @Override
    public TreeNode visitInteger(Expression.Integer integer) {
        return TreeNode.leaf("Integer(" + Literals.integer(integer.value()) + ")");
    }

    @Override
    public TreeNode visitFloat(Expression.Float floating) {
        return TreeNode.leaf("Float(" + Literals.floating(floating.value()) + ")");
    }

    @Override
    public TreeNode visitNegative(Expression.Negative negative) {
        return TreeNode.node(NEGATIVE, negative.operand()
                                               .accept(this));
    }

    @Override
    public TreeNode visitAdd(Expression.Add add) {
        return binary(add);
    }

    @Override
    public TreeNode visitSubtract(Expression.Subtract subtract) {
        return binary(subtract);
    }

    @Override
    public TreeNode visitMultiply(Expression.Multiply multiply) {
        return binary(multiply);
    }

    @Override
    public TreeNode visitDivide(Expression.Divide divide) {
        return binary(divide);
    }

    private TreeNode binary(Expression.Binary binary) {
        return TreeNode.node(binary.operator()
                                   .label(),
                             binary.left()
                                   .accept(this),
                             binary.right()
                                   .accept(this));
    }
}
