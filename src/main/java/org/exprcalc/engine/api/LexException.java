package org.exprcalc.engine.api;

/**
 * Thrown by the lexer when the input cannot be split into tokens.
 */
public class LexException extends CalculationException {

    public LexException(CalculatorErrorCode errorCode, String message, int position) {
        super(errorCode, message, position);
    }
}
