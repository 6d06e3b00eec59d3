package org.pragmatica.arbor.tree;

import org.pragmatica.arbor.error.ConstructionException;
import org.pragmatica.arbor.error.TreeError;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable labeled tree element - either a {@link Leaf} or a {@link Node} with ordered children.
 *
 * <p>Example:
 * <pre>{@code
 * var scene = TreeNode.node("Scene",
 *                           TreeNode.node("Robot", TreeNode.leaf("Camera")),
 *                           TreeNode.node("Table", TreeNode.leaf("Box")));
 * }</pre>
 */
public sealed interface TreeNode {
    /**
     * Display name, printed verbatim.
     */
    String name();

    /**
     * Dispatch to the visitor handler for this variant.
     *
     * @param visitor the operation to apply
     * @param context traversal state handed down by the caller
     */
    <R, C> R accept(TreeVisitor<R, C> visitor, C context);

    static Leaf leaf(String name) {
        return new Leaf(name);
    }

    static Node node(String name, TreeNode... children) {
        return new Node(name, children == null ? null : Arrays.asList(children));
    }

    static Node node(String name, List<? extends TreeNode> children) {
        return new Node(name, children == null ? null : new ArrayList<TreeNode>(children));
    }

    /**
     * Terminal element without children.
     */
    record Leaf(String name) implements TreeNode {
        public Leaf {
            if (name == null) {
                throw new ConstructionException(new TreeError.MissingName("Leaf"));
            }
        }

        @Override
        public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
            return visitor.visitLeaf(this, context);
        }
    }

    /**
     * Internal element owning one or more ordered children.
     */
    record Node(String name, List<TreeNode> children) implements TreeNode {
        public Node {
            if (name == null) {
                throw new ConstructionException(new TreeError.MissingName("Node"));
            }
            if (children == null || children.isEmpty()) {
                throw new ConstructionException(new TreeError.EmptyChildren(name));
            }
            var copy = new ArrayList<TreeNode>(children.size());
            for (var child : children) {
                if (child == null) {
                    throw new ConstructionException(new TreeError.MissingChild(name, copy.size()));
                }
                copy.add(child);
            }
            children = Collections.unmodifiableList(copy);
        }

        @Override
        public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
            return visitor.visitNode(this, context);
        }

        /**
         * Whether the child at {@code index} is the last one in stored order.
         */
        public boolean isLast(int index) {
            return index == children.size() - 1;
        }
    }
}
