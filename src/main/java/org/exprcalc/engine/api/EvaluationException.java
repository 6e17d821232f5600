package org.exprcalc.engine.api;

/**
 * Thrown by the evaluator when an arithmetic operation has no defined result.
 */
public class EvaluationException extends CalculationException {

    public EvaluationException(CalculatorErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public EvaluationException(CalculatorErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, NO_POSITION, cause);
    }
}
