package org.exprcalc.engine.frontend.lexer;

/**
 * Represents a single token extracted from the input line by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Number, Plus, LeftParen).
 * @param text The exact text of the token from the input. Empty for {@link TokenType#END_OF_INPUT}.
 * @param position The zero-based offset of the token's first character in the input.
 */
public record Token(
        TokenType type,
        String text,
        int position
) {

    /**
     * Describes the token for error messages, e.g. {@code '+'} or {@code end of input}.
     * @return A human-readable description.
     */
    public String describe() {
        return type == TokenType.END_OF_INPUT ? "end of input" : "'" + text + "'";
    }
}
