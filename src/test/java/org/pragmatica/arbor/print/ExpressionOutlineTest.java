package org.pragmatica.arbor.print;

import org.junit.jupiter.api.Test;
import org.pragmatica.arbor.expr.Expression;
import org.pragmatica.arbor.tree.TreeNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.arbor.expr.Expression.add;
import static org.pragmatica.arbor.expr.Expression.divide;
import static org.pragmatica.arbor.expr.Expression.floating;
import static org.pragmatica.arbor.expr.Expression.integer;
import static org.pragmatica.arbor.expr.Expression.multiply;
import static org.pragmatica.arbor.expr.Expression.negative;
import static org.pragmatica.arbor.expr.Expression.subtract;

class ExpressionOutlineTest {

    private static final Expression EXAMPLE =
        add(integer(2), divide(multiply(floating(5.0), negative(integer(3))), floating(10.0)));

    @Test
    void values_becomeLabeledLeaves() {
        assertEquals(TreeNode.leaf("Integer(42)"), ExpressionOutline.INSTANCE.outline(integer(42)));
        assertEquals(TreeNode.leaf("Float(2.5)"), ExpressionOutline.INSTANCE.outline(floating(2.5)));
    }

    @Test
    void operations_becomeNodesNamedAfterVariant() {
        var outline = ExpressionOutline.INSTANCE.outline(subtract(integer(1), negative(integer(2))));

        assertEquals(TreeNode.node("Subtract",
                                   TreeNode.leaf("Integer(1)"),
                                   TreeNode.node("Negative", TreeNode.leaf("Integer(2)"))),
                     outline);
    }

    @Test
    void bullet_example_listsOperationsAndValues() {
        var printer = TreePrinter.create(PrinterConfig.DEFAULT.withStyle(TreeStyle.BULLET));

        assertEquals("* Add\n  * Integer(2)\n  * Divide\n    * Multiply\n      * Float(5.0)\n      * Negative\n        * Integer(3)\n    * Float(10.0)",
                     printer.print(ExpressionOutline.INSTANCE.outline(EXAMPLE)));
    }

    @Test
    void tree_example_drawsFolderDiagram() {
        var text = TreePrinter.create()
                              .print(ExpressionOutline.INSTANCE.outline(EXAMPLE));

        assertThat(text.split("\n")).containsExactly(
            " ╿ Add",
            " ├─╼ Integer(2)",
            " └─┮ Divide",
            "   ├─┮ Multiply",
            "   │ ├─╼ Float(5.0)",
            "   │ └─┮ Negative",
            "   │   └─╼ Integer(3)",
            "   └─╼ Float(10.0)");
    }
}
