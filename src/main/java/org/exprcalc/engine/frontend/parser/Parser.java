package org.exprcalc.engine.frontend.parser;

import org.exprcalc.engine.api.CalculatorErrorCode;
import org.exprcalc.engine.api.NumericValue;
import org.exprcalc.engine.api.ParseException;
import org.exprcalc.engine.frontend.lexer.Token;
import org.exprcalc.engine.frontend.lexer.TokenType;
import org.exprcalc.engine.frontend.parser.ast.AstNode;
import org.exprcalc.engine.frontend.parser.ast.BinaryOpNode;
import org.exprcalc.engine.frontend.parser.ast.BinaryOperator;
import org.exprcalc.engine.frontend.parser.ast.NumberLiteralNode;
import org.exprcalc.engine.frontend.parser.ast.UnaryOpNode;
import org.exprcalc.engine.frontend.parser.ast.UnaryOperator;

import java.util.List;
import java.util.Optional;

/**
 * A recursive descent parser for arithmetic expressions. It consumes a list of tokens
 * from the {@link org.exprcalc.engine.frontend.lexer.Lexer} and produces an Abstract Syntax Tree (AST).
 * <p>
 * Grammar, lowest precedence first:
 * <pre>
 *  expression : addsub
 *  addsub     : muldiv ( ('+' | '-') muldiv )*
 *  muldiv     : unary ( ('*' | '/' | '%') unary )*
 *  unary      : ('-' | '+') unary | power
 *  power      : primary ( '^' unary )?
 *  primary    : NUMBER | '(' expression ')'
 * </pre>
 * A parser instance is single-use and stops at the first error.
 */
public class Parser {

    /** The nesting depth allowed when no explicit limit is given. */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private final List<Token> tokens;
    private final int maxNestingDepth;
    private int current = 0;
    private int depth = 0;

    /**
     * Constructs a new Parser with the default nesting limit.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_INPUT}.
     */
    public Parser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_INPUT}.
     * @param maxNestingDepth The maximum number of simultaneously open parentheses, unary operators and exponents.
     */
    public Parser(List<Token> tokens, int maxNestingDepth) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END_OF_INPUT) {
            throw new IllegalArgumentException("Token list must end with END_OF_INPUT.");
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, was " + maxNestingDepth);
        }
        this.tokens = tokens;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses the whole token stream as a single expression.
     * @return The root of the AST.
     * @throws ParseException if the tokens do not form exactly one complete expression.
     */
    public AstNode parse() throws ParseException {
        AstNode expression = expression();
        if (!isAtEnd()) {
            Token trailing = peek();
            throw new ParseException(CalculatorErrorCode.TRAILING_TOKENS,
                    "unexpected " + trailing.describe() + " at position " + trailing.position() + " after end of expression",
                    trailing.position());
        }
        return expression;
    }

    private AstNode expression() throws ParseException {
        return addSub();
    }

    private AstNode addSub() throws ParseException {
        AstNode left = mulDiv();
        Optional<BinaryOperator> op;
        while ((op = matchOperator(BinaryOperator.ADD.precedence())).isPresent()) {
            left = new BinaryOpNode(op.get(), left, mulDiv());
        }
        return left;
    }

    private AstNode mulDiv() throws ParseException {
        AstNode left = unary();
        Optional<BinaryOperator> op;
        while ((op = matchOperator(BinaryOperator.MULTIPLY.precedence())).isPresent()) {
            left = new BinaryOpNode(op.get(), left, unary());
        }
        return left;
    }

    private AstNode unary() throws ParseException {
        if (match(TokenType.MINUS, TokenType.PLUS)) {
            Token sign = previous();
            UnaryOperator operator = sign.type() == TokenType.MINUS ? UnaryOperator.NEGATE : UnaryOperator.IDENTITY;
            enterNesting(sign);
            AstNode operand = unary();
            depth--;
            return new UnaryOpNode(operator, operand);
        }
        return power();
    }

    private AstNode power() throws ParseException {
        AstNode base = primary();
        if (match(TokenType.POWER)) {
            enterNesting(previous());
            // The exponent may itself be signed and raised again: right associativity.
            AstNode exponent = unary();
            depth--;
            return new BinaryOpNode(BinaryOperator.POWER, base, exponent);
        }
        return base;
    }

    private AstNode primary() throws ParseException {
        if (match(TokenType.NUMBER)) {
            return number(previous());
        }

        if (match(TokenType.LEFT_PAREN)) {
            Token open = previous();
            enterNesting(open);
            AstNode inner = expression();
            depth--;
            if (!match(TokenType.RIGHT_PAREN)) {
                Token unexpected = peek();
                throw new ParseException(CalculatorErrorCode.MISSING_CLOSING_PAREN,
                        "missing ')' for '(' at position " + open.position() + ", found " + unexpected.describe(),
                        unexpected.position());
            }
            return inner;
        }

        Token unexpected = peek();
        throw new ParseException(CalculatorErrorCode.UNEXPECTED_TOKEN,
                "unexpected " + unexpected.describe() + " at position " + unexpected.position() + ", expected a number or '('",
                unexpected.position());
    }

    private AstNode number(Token token) throws ParseException {
        String text = token.text();
        try {
            if (text.indexOf('.') >= 0) {
                double value = Double.parseDouble(text);
                if (Double.isInfinite(value)) {
                    throw new ParseException(CalculatorErrorCode.INVALID_NUMBER,
                            "number '" + text + "' at position " + token.position() + " is out of range", token.position());
                }
                return new NumberLiteralNode(NumericValue.of(value));
            }
            return new NumberLiteralNode(NumericValue.of(Long.parseLong(text)));
        } catch (NumberFormatException e) {
            throw new ParseException(CalculatorErrorCode.INVALID_NUMBER,
                    "invalid number '" + text + "' at position " + token.position(), token.position(), e);
        }
    }

    private void enterNesting(Token token) throws ParseException {
        if (++depth > maxNestingDepth) {
            throw new ParseException(CalculatorErrorCode.NESTING_TOO_DEEP,
                    "expression nested deeper than " + maxNestingDepth + " levels at position " + token.position(),
                    token.position());
        }
    }

    private Optional<BinaryOperator> matchOperator(int precedence) {
        Optional<BinaryOperator> op = BinaryOperator.fromTokenType(peek().type())
                .filter(candidate -> candidate.precedence() == precedence);
        op.ifPresent(ignored -> advance());
        return op;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_INPUT;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }
}
