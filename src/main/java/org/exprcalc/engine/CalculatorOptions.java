package org.exprcalc.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.exprcalc.engine.evaluator.ZeroDivisorPolicy;
import org.exprcalc.engine.frontend.parser.Parser;

/**
 * Immutable settings of a {@link Calculator}.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * exprcalc.calculator {
 *   max-nesting-depth = 256          # open parentheses, unary operators and exponents
 *   max-input-length = 4096          # characters per input line, at most 65536
 *   float-division-by-zero = "IEEE"  # "IEEE" (Infinity/NaN) or "ERROR"
 * }
 * </pre>
 *
 * @param maxNestingDepth The maximum parser nesting depth.
 * @param maxInputLength The maximum number of characters of an input line.
 * @param floatZeroDivisorPolicy How floating point division and modulo treat a zero divisor.
 */
public record CalculatorOptions(
        int maxNestingDepth,
        int maxInputLength,
        ZeroDivisorPolicy floatZeroDivisorPolicy
) {
    /** Default maximum input line length. */
    public static final int DEFAULT_MAX_INPUT_LENGTH = 4096;
    /** Largest accepted {@code max-input-length}. */
    public static final int MAX_INPUT_LENGTH_LIMIT = 65536;

    private static final String MAX_NESTING_DEPTH_KEY = "max-nesting-depth";
    private static final String MAX_INPUT_LENGTH_KEY = "max-input-length";
    private static final String FLOAT_DIVISION_BY_ZERO_KEY = "float-division-by-zero";

    public CalculatorOptions {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, was " + maxNestingDepth);
        }
        if (maxInputLength < 1 || maxInputLength > MAX_INPUT_LENGTH_LIMIT) {
            throw new IllegalArgumentException("maxInputLength must be between 1 and " + MAX_INPUT_LENGTH_LIMIT
                    + ", was " + maxInputLength);
        }
        if (floatZeroDivisorPolicy == null) {
            throw new IllegalArgumentException("floatZeroDivisorPolicy must not be null");
        }
    }

    /**
     * Gets the built-in defaults, matching {@code reference.conf}.
     * @return The default options.
     */
    public static CalculatorOptions defaults() {
        return new CalculatorOptions(Parser.DEFAULT_MAX_NESTING_DEPTH, DEFAULT_MAX_INPUT_LENGTH, ZeroDivisorPolicy.IEEE);
    }

    /**
     * Reads the options from a configuration block. Missing keys fall back to the defaults.
     * @param config The {@code exprcalc.calculator} block.
     * @return The options.
     * @throws ConfigException if a present key has the wrong type or is out of range.
     */
    public static CalculatorOptions fromConfig(Config config) {
        CalculatorOptions defaults = defaults();
        int maxNestingDepth = config.hasPath(MAX_NESTING_DEPTH_KEY)
                ? config.getInt(MAX_NESTING_DEPTH_KEY)
                : defaults.maxNestingDepth();
        int maxInputLength = config.hasPath(MAX_INPUT_LENGTH_KEY)
                ? config.getInt(MAX_INPUT_LENGTH_KEY)
                : defaults.maxInputLength();
        ZeroDivisorPolicy policy = config.hasPath(FLOAT_DIVISION_BY_ZERO_KEY)
                ? config.getEnum(ZeroDivisorPolicy.class, FLOAT_DIVISION_BY_ZERO_KEY)
                : defaults.floatZeroDivisorPolicy();
        if (maxNestingDepth < 1) {
            throw new ConfigException.BadValue(config.origin(), MAX_NESTING_DEPTH_KEY,
                    "must be positive, was " + maxNestingDepth);
        }
        if (maxInputLength < 1 || maxInputLength > MAX_INPUT_LENGTH_LIMIT) {
            throw new ConfigException.BadValue(config.origin(), MAX_INPUT_LENGTH_KEY,
                    "must be between 1 and " + MAX_INPUT_LENGTH_LIMIT + ", was " + maxInputLength);
        }
        return new CalculatorOptions(maxNestingDepth, maxInputLength, policy);
    }
}
