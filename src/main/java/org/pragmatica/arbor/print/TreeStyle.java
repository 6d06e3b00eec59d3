package org.pragmatica.arbor.print;

/**
 * Layouts available to {@link TreePrinter}.
 */
public enum TreeStyle {
    /**
     * Folder diagram with box-drawing connectors:
     * <pre>
     *  ╿ Scene
     *  ├─┮ Robot
     *  │ └─╼ Camera
     *  └─┮ Table
     *    └─╼ Box
     * </pre>
     */
    TREE,
    /**
     * Two spaces per level, name only.
     */
    INDENT,
    /**
     * Two spaces per level, each name preceded by {@code "* "}.
     */
    BULLET
}
