package org.pragmatica.arbor.expr;

/**
 * Binary arithmetic operators with their infix symbols.
 */
public enum Operator {
    ADD("+", "Add"),
    SUBTRACT("-", "Subtract"),
    MULTIPLY("*", "Multiply"),
    DIVIDE("/", "Divide");

    private final String symbol;
    private final String label;

    Operator(String symbol, String label) {
        this.symbol = symbol;
        this.label = label;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Name of the expression variant, as shown in outlines.
     */
    public String label() {
        return label;
    }
}
