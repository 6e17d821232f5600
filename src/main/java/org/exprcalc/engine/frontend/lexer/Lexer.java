package org.exprcalc.engine.frontend.lexer;

import org.exprcalc.engine.api.CalculatorErrorCode;
import org.exprcalc.engine.api.LexException;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * an input line into a sequence of tokens.
 * <p>
 * Tokens are produced on demand by {@link #nextToken()}. The lexer only holds a cursor
 * into the input and never looks back; once the input is exhausted it keeps returning
 * {@link TokenType#END_OF_INPUT}.
 */
public class Lexer {

    private final String source;
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The input line.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Performs the tokenization of the entire input.
     * @return A list of the recognized tokens, terminated by a single {@link TokenType#END_OF_INPUT} token.
     * @throws LexException on the first character sequence that is not a valid token.
     */
    public List<Token> scanTokens() throws LexException {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_INPUT);
        return tokens;
    }

    /**
     * Scans the next token.
     * @return The next token, or {@link TokenType#END_OF_INPUT} if the input is exhausted.
     * @throws LexException if the next characters do not form a valid token.
     */
    public Token nextToken() throws LexException {
        skipWhitespace();
        start = current;
        if (isAtEnd()) {
            return new Token(TokenType.END_OF_INPUT, "", current);
        }

        char c = advance();
        switch (c) {
            case '+': return makeToken(TokenType.PLUS);
            case '-': return makeToken(TokenType.MINUS);
            case '*': return makeToken(TokenType.MULTIPLY);
            case '/': return makeToken(TokenType.DIVIDE);
            case '%': return makeToken(TokenType.MODULO);
            case '^': return makeToken(TokenType.POWER);
            case '(': return makeToken(TokenType.LEFT_PAREN);
            case ')': return makeToken(TokenType.RIGHT_PAREN);
            default:
                if (isDigit(c) || c == '.') {
                    return number();
                }
                throw new LexException(CalculatorErrorCode.UNKNOWN_CHARACTER,
                        "unknown character '" + c + "' at position " + start, start);
        }
    }

    private Token number() throws LexException {
        boolean seenDecimalPoint = previous() == '.';
        boolean seenDigit = !seenDecimalPoint;
        while (isDigit(peek()) || peek() == '.') {
            char c = advance();
            if (c == '.') {
                if (seenDecimalPoint) {
                    throw new LexException(CalculatorErrorCode.MALFORMED_NUMBER,
                            "number with multiple decimal points at position " + start, start);
                }
                seenDecimalPoint = true;
            } else {
                seenDigit = true;
            }
        }

        if (!seenDigit) {
            throw new LexException(CalculatorErrorCode.MALFORMED_NUMBER,
                    "decimal point without digits at position " + start, start);
        }
        return makeToken(TokenType.NUMBER);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            switch (peek()) {
                case ' ', '\r', '\t', '\n' -> current++;
                default -> {
                    return;
                }
            }
        }
    }

    private Token makeToken(TokenType type) {
        return new Token(type, source.substring(start, current), start);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
