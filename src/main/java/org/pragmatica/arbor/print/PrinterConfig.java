package org.pragmatica.arbor.print;

/**
 * Tree printer configuration options.
 */
public record PrinterConfig(
    TreeStyle style,
    String lineSeparator
) {
    public static final PrinterConfig DEFAULT = new PrinterConfig(
        TreeStyle.TREE,
        "\n"
    );

    public PrinterConfig withStyle(TreeStyle style) {
        return new PrinterConfig(style, lineSeparator);
    }
}
