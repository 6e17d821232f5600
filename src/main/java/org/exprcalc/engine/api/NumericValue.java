package org.exprcalc.engine.api;

/**
 * The result type of a calculation: either an exact 64-bit integer or a double.
 * <p>
 * Literals without a decimal point are integers, literals with one are floating point.
 * Arithmetic on two integers stays integral; as soon as one operand is floating point,
 * the result is floating point.
 */
public sealed interface NumericValue {

    static NumericValue of(long value) {
        return new IntegerValue(value);
    }

    static NumericValue of(double value) {
        return new FloatValue(value);
    }

    /**
     * Gets the value widened to a double.
     * @return The value as a double.
     */
    double asDouble();

    /**
     * Checks whether the value is (positive or negative) zero.
     * @return {@code true} if the value is zero.
     */
    boolean isZero();

    /**
     * An exact integer value.
     *
     * @param value The integer value.
     */
    record IntegerValue(long value) implements NumericValue {
        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public boolean isZero() {
            return value == 0;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * An IEEE 754 double value. May be NaN or infinite as the result of a calculation.
     *
     * @param value The floating point value.
     */
    record FloatValue(double value) implements NumericValue {
        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public boolean isZero() {
            return value == 0.0;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }
}
