package org.exprcalc.engine.api;

/**
 * An exception that is thrown when an expression cannot be tokenized, parsed or evaluated.
 * <p>
 * It is part of the public API. Each instance carries a {@link CalculatorErrorCode} and,
 * where the error can be attributed to a place in the input, the zero-based character position.
 */
public class CalculationException extends Exception {

    /** Position value used when an error has no location in the input. */
    public static final int NO_POSITION = -1;

    private final CalculatorErrorCode errorCode;
    private final int position;

    /**
     * Constructs a new calculation exception without a position.
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public CalculationException(CalculatorErrorCode errorCode, String message) {
        this(errorCode, message, NO_POSITION);
    }

    /**
     * Constructs a new calculation exception.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param position The zero-based position in the input, or {@link #NO_POSITION}.
     */
    public CalculationException(CalculatorErrorCode errorCode, String message, int position) {
        super(message, null);
        this.errorCode = errorCode;
        this.position = position;
    }

    /**
     * Constructs a new calculation exception with a cause.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param position The zero-based position in the input, or {@link #NO_POSITION}.
     * @param cause The cause.
     */
    public CalculationException(CalculatorErrorCode errorCode, String message, int position, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.position = position;
    }

    public CalculatorErrorCode getErrorCode() {
        return errorCode;
    }

    public int getPosition() {
        return position;
    }

    /**
     * Checks whether the error could be attributed to a position in the input.
     * @return {@code true} if a position is known.
     */
    public boolean hasPosition() {
        return position != NO_POSITION;
    }
}
