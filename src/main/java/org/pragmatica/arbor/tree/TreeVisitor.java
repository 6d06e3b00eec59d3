package org.pragmatica.arbor.tree;

/**
 * Operation over the generic tree family. One handler per variant; there is no fallback.
 *
 * @param <R> result of visiting an element
 * @param <C> traversal context passed from parent to child
 */
public interface TreeVisitor<R, C> {
    R visitLeaf(TreeNode.Leaf leaf, C context);

    R visitNode(TreeNode.Node node, C context);
}
