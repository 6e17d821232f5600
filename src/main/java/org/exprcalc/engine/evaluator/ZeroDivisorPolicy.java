package org.exprcalc.engine.evaluator;

/**
 * Controls what happens when a floating point division or modulo has a zero divisor.
 * Integer operations always fail on a zero divisor.
 */
public enum ZeroDivisorPolicy {
    /** Follow IEEE 754: the result is infinite or NaN. */
    IEEE,
    /** Fail with a division or modulo by zero error, like integer operations. */
    ERROR
}
