package org.pragmatica.arbor;

import org.junit.jupiter.api.Test;
import org.pragmatica.arbor.error.ConstructionException;
import org.pragmatica.arbor.error.DivisionByZeroException;
import org.pragmatica.arbor.expr.Expression;
import org.pragmatica.arbor.print.TreeStyle;
import org.pragmatica.arbor.tree.TreeNode;

import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.arbor.expr.Expression.add;
import static org.pragmatica.arbor.expr.Expression.divide;
import static org.pragmatica.arbor.expr.Expression.floating;
import static org.pragmatica.arbor.expr.Expression.integer;
import static org.pragmatica.arbor.expr.Expression.multiply;
import static org.pragmatica.arbor.expr.Expression.negative;
import static org.pragmatica.arbor.tree.TreeNode.leaf;
import static org.pragmatica.arbor.tree.TreeNode.node;

/**
 * End-to-end scenarios through the public entry points.
 */
class ArborTest {

    private static final TreeNode SCENE = node("Scene",
                                               node("Robot",
                                                    node("Flange", node("Gripper", leaf("Object"))),
                                                    leaf("Camera")),
                                               node("Table", leaf("Box")));

    private static final Expression EXAMPLE =
        add(integer(2), divide(multiply(floating(5.0), negative(integer(3))), floating(10.0)));

    @Test
    void printTree_scene() {
        assertEquals(" ╿ Scene\n ├─┮ Robot\n │ ├─┮ Flange\n │ │ └─┮ Gripper\n │ │   └─╼ Object\n │ └─╼ Camera\n └─┮ Table\n   └─╼ Box",
                     Arbor.printTree(SCENE));
    }

    @Test
    void printTree_withStyle() {
        assertEquals("Table\n  Box", Arbor.printTree(node("Table", leaf("Box")), TreeStyle.INDENT));
        assertEquals("* Table\n  * Box", Arbor.printTree(node("Table", leaf("Box")), TreeStyle.BULLET));
    }

    @Test
    void printTree_expression() {
        assertEquals(" ╿ Negative\n └─╼ Integer(3)", Arbor.printTree(negative(integer(3))));
        assertEquals("* Divide\n  * Integer(5)\n  * Integer(2)",
                     Arbor.printTree(divide(integer(5), integer(2)), TreeStyle.BULLET));
    }

    @Test
    void printExpression_example() {
        assertEquals("2 + ((5.0 * -3) / 10.0)", Arbor.printExpression(EXAMPLE));
    }

    @Test
    void evaluate_example() {
        assertEquals(0.5, Arbor.evaluate(EXAMPLE));
    }

    @Test
    void evaluate_divisionByZero() {
        assertThrows(DivisionByZeroException.class, () -> Arbor.evaluate(divide(integer(5), integer(0))));
    }

    @Test
    void node_withoutChildren() {
        assertThrows(ConstructionException.class, () -> node("X"));
    }

    @Test
    void printer_builder_appliesConfiguration() {
        var printer = Arbor.printer()
                           .style(TreeStyle.BULLET)
                           .lineSeparator(" | ")
                           .build();

        assertEquals("* Table |   * Box", printer.print(node("Table", leaf("Box"))));
        assertEquals(TreeStyle.BULLET, printer.config().style());
    }

    @Test
    void printer_builder_rejectsMissingValues() {
        assertThrows(NullPointerException.class, () -> Arbor.printer().style(null));
        assertThrows(NullPointerException.class, () -> Arbor.printer().lineSeparator(null));
    }

    @Test
    void sharedTrees_traversedFromSeveralThreads_yieldIdenticalResults() throws Exception {
        var expectedTree = Arbor.printTree(SCENE);
        var expectedText = Arbor.printExpression(EXAMPLE);
        var expectedValue = Arbor.evaluate(EXAMPLE);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            var tasks = new ArrayList<Callable<Boolean>>();
            for (int i = 0; i < 32; i++) {
                tasks.add(() -> expectedTree.equals(Arbor.printTree(SCENE))
                                && expectedText.equals(Arbor.printExpression(EXAMPLE))
                                && expectedValue.equals(Arbor.evaluate(EXAMPLE)));
            }
            for (Future<Boolean> result : executor.invokeAll(tasks)) {
                assertThat(result.get()).isTrue();
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
