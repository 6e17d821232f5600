package org.exprcalc.engine.frontend.parser.ast;

/**
 * The prefix operators of the expression language.
 */
public enum UnaryOperator {
    /** Arithmetic negation, written '-'. */
    NEGATE("-"),
    /** No-op sign, written '+'. */
    IDENTITY("+");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
