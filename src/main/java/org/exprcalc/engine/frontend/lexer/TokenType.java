package org.exprcalc.engine.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** A numeric literal, with or without a decimal point. */
    NUMBER,

    // Single-character tokens.
    /** The '+' character. */
    PLUS,
    /** The '-' character. */
    MINUS,
    /** The '*' character. */
    MULTIPLY,
    /** The '/' character. */
    DIVIDE,
    /** The '%' character. */
    MODULO,
    /** The '^' character. */
    POWER,
    /** The '(' character. */
    LEFT_PAREN,
    /** The ')' character. */
    RIGHT_PAREN,

    // Miscellaneous.
    /** Represents the end of the input line. */
    END_OF_INPUT
}
