package org.exprcalc.engine.api;

/**
 * Defines unique, testable error codes for all errors that can occur while
 * calculating an expression. This decouples the test logic from the error messages.
 */
public enum CalculatorErrorCode {
    // region Lexer Errors
    /** The input contains a character outside the recognized token set. */
    UNKNOWN_CHARACTER,
    /** A numeric literal contains more than one decimal point, or no digit at all. */
    MALFORMED_NUMBER,
    /** The input line exceeds the configured maximum length. */
    INPUT_TOO_LONG,
    // endregion

    // region Parser Errors
    /** A token appears where the grammar forbids it. */
    UNEXPECTED_TOKEN,
    /** An opened parenthesis is never closed. */
    MISSING_CLOSING_PAREN,
    /** Input remains after a complete expression has been parsed. */
    TRAILING_TOKENS,
    /** A numeric literal cannot be represented (e.g. an integer beyond 64 bits). */
    INVALID_NUMBER,
    /** Parentheses, unary operators or exponents are nested deeper than allowed. */
    NESTING_TOO_DEEP,
    // endregion

    // region Evaluation Errors
    /** The right operand of '/' is zero. */
    DIVISION_BY_ZERO,
    /** The right operand of '%' is zero. */
    MODULO_BY_ZERO,
    /** An integer operation does not fit into 64 bits. */
    ARITHMETIC_OVERFLOW;
    // endregion

    /**
     * The pipeline stage an error code belongs to.
     */
    public enum Stage {
        /** Lexical analysis. */
        LEXER,
        /** Parsing into an AST. */
        PARSER,
        /** Evaluation of the AST. */
        EVALUATOR
    }

    /**
     * Gets the pipeline stage this code is reported by.
     * @return The stage.
     */
    public Stage stage() {
        return switch (this) {
            case UNKNOWN_CHARACTER, MALFORMED_NUMBER, INPUT_TOO_LONG -> Stage.LEXER;
            case UNEXPECTED_TOKEN, MISSING_CLOSING_PAREN, TRAILING_TOKENS, INVALID_NUMBER, NESTING_TOO_DEEP -> Stage.PARSER;
            case DIVISION_BY_ZERO, MODULO_BY_ZERO, ARITHMETIC_OVERFLOW -> Stage.EVALUATOR;
        };
    }
}
