package org.exprcalc.engine.api;

/**
 * Thrown by the parser when the token sequence does not form a valid expression.
 */
public class ParseException extends CalculationException {

    public ParseException(CalculatorErrorCode errorCode, String message, int position) {
        super(errorCode, message, position);
    }

    public ParseException(CalculatorErrorCode errorCode, String message, int position, Throwable cause) {
        super(errorCode, message, position, cause);
    }
}
