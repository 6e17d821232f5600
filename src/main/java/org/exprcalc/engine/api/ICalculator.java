package org.exprcalc.engine.api;

import org.exprcalc.engine.frontend.lexer.Token;
import org.exprcalc.engine.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Defines the public interface of the expression calculator.
 */
public interface ICalculator {

    /**
     * Splits an input line into tokens.
     *
     * @param input The input line.
     * @return The tokens, terminated by an end-of-input token.
     * @throws CalculationException if the input contains an invalid character or number.
     */
    List<Token> tokenize(String input) throws CalculationException;

    /**
     * Parses an input line into an abstract syntax tree.
     *
     * @param input The input line.
     * @return The root of the AST.
     * @throws CalculationException if the input is not a single well-formed expression.
     */
    AstNode parse(String input) throws CalculationException;

    /**
     * Evaluates a previously parsed tree.
     *
     * @param ast The root of the AST.
     * @return The value of the expression.
     * @throws CalculationException if the value is undefined, e.g. on division by zero.
     */
    NumericValue evaluate(AstNode ast) throws CalculationException;

    /**
     * Parses and evaluates an input line.
     *
     * @param input The input line.
     * @return The value of the expression.
     * @throws CalculationException on the first lexical, syntactic or arithmetic error.
     */
    default NumericValue calculate(String input) throws CalculationException {
        return evaluate(parse(input));
    }
}
