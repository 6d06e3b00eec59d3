package org.pragmatica.arbor.print;

import org.pragmatica.arbor.tree.TreeNode;
import org.pragmatica.arbor.tree.TreeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a generic tree, one line per element in pre-order.
 *
 * <p>Instances are immutable; traversal state lives in the {@link Indent} handed from parent to child,
 * so one printer may be shared between threads.
 */
public final class TreePrinter implements TreeVisitor<String, TreePrinter.Indent> {
    private static final Logger LOG = LoggerFactory.getLogger(TreePrinter.class);

    private static final String LEAD = " ";
    private static final String ROOT = "╿ ";
    private static final String NODE_MIDDLE = "├─┮ ";
    private static final String NODE_LAST = "└─┮ ";
    private static final String LEAF_MIDDLE = "├─╼ ";
    private static final String LEAF_LAST = "└─╼ ";
    private static final String GUIDE_CONTINUE = "│ ";
    private static final String GUIDE_EMPTY = "  ";
    private static final String LEVEL = "  ";
    private static final String BULLET = "* ";

    private static final TreeVisitor<Integer, Void> LINE_COUNTER = new TreeVisitor<>() {
        @Override
        public Integer visitLeaf(TreeNode.Leaf leaf, Void context) {
            return 1;
        }

        @Override
        public Integer visitNode(TreeNode.Node node, Void context) {
            var lines = 1;
            for (var child : node.children()) {
                lines += child.accept(this, null);
            }
            return lines;
        }
    };

    private final PrinterConfig config;

    private TreePrinter(PrinterConfig config) {
        this.config = config;
    }

    public static TreePrinter create() {
        return create(PrinterConfig.DEFAULT);
    }

    public static TreePrinter create(PrinterConfig config) {
        return new TreePrinter(config);
    }

    public PrinterConfig config() {
        return config;
    }

    /**
     * Render the tree rooted at {@code root}.
     */
    public String print(TreeNode root) {
        var text = root.accept(this, Indent.ROOT);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Printed tree '{}' in {} style, {} lines", root.name(), config.style(), root.accept(LINE_COUNTER, null));
        }
        return text;
    }

    @Override
    public String visitLeaf(TreeNode.Leaf leaf, Indent indent) {
        return line(leaf.name(), indent, false);
    }

    @Override
    public String visitNode(TreeNode.Node node, Indent indent) {
        var sb = new StringBuilder(line(node.name(), indent, true));
        var children = node.children();
        for (int i = 0; i < children.size(); i++) {
            sb.append(config.lineSeparator())
              .append(children.get(i)
                              .accept(this, indent.child(node.isLast(i))));
        }
        return sb.toString();
    }

    private String line(String name, Indent indent, boolean hasChildren) {
        return switch (config.style()) {
            case TREE -> LEAD + indent.guides() + connector(indent, hasChildren) + name;
            case INDENT -> LEVEL.repeat(indent.depth()) + name;
            case BULLET -> LEVEL.repeat(indent.depth()) + BULLET + name;
        };
    }

    private static String connector(Indent indent, boolean hasChildren) {
        if (indent.isRoot()) {
            return ROOT;
        }
        if (hasChildren) {
            return indent.last()
                   ? NODE_LAST
                   : NODE_MIDDLE;
        }
        return indent.last()
               ? LEAF_LAST
               : LEAF_MIDDLE;
    }

    /**
     * Position of an element relative to its ancestors.
     *
     * @param guides vertical guides contributed by ancestors below the root
     * @param depth  distance from the root
     * @param last   whether the element is the last child of its parent
     */
    public record Indent(String guides, int depth, boolean last) {
        public static final Indent ROOT = new Indent("", 0, true);

        public boolean isRoot() {
            return depth == 0;
        }

        Indent child(boolean lastChild) {
            var childGuides = isRoot()
                              ? guides
                              : guides + (last ? GUIDE_EMPTY : GUIDE_CONTINUE);
            return new Indent(childGuides, depth + 1, lastChild);
        }
    }
}
