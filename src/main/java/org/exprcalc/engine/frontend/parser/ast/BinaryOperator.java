package org.exprcalc.engine.frontend.parser.ast;

import org.exprcalc.engine.frontend.lexer.TokenType;

import java.util.Optional;

/**
 * The infix operators of the expression language, with their token type and precedence.
 * Higher precedence binds tighter. All operators are left-associative except {@link #POWER}.
 */
public enum BinaryOperator {
    ADD("+", TokenType.PLUS, 1),
    SUBTRACT("-", TokenType.MINUS, 1),
    MULTIPLY("*", TokenType.MULTIPLY, 2),
    DIVIDE("/", TokenType.DIVIDE, 2),
    MODULO("%", TokenType.MODULO, 2),
    /** Exponentiation, the only right-associative operator. */
    POWER("^", TokenType.POWER, 3);

    private final String symbol;
    private final TokenType tokenType;
    private final int precedence;

    BinaryOperator(String symbol, TokenType tokenType, int precedence) {
        this.symbol = symbol;
        this.tokenType = tokenType;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public TokenType tokenType() {
        return tokenType;
    }

    public int precedence() {
        return precedence;
    }

    /**
     * Finds the operator written with the given token type.
     * @param type The token type.
     * @return The operator, or empty if the token is not an infix operator.
     */
    public static Optional<BinaryOperator> fromTokenType(TokenType type) {
        for (BinaryOperator op : values()) {
            if (op.tokenType == type) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
