package org.exprcalc.engine;

import org.exprcalc.engine.api.CalculationException;
import org.exprcalc.engine.api.CalculatorErrorCode;
import org.exprcalc.engine.api.ICalculator;
import org.exprcalc.engine.api.LexException;
import org.exprcalc.engine.api.NumericValue;
import org.exprcalc.engine.evaluator.Evaluator;
import org.exprcalc.engine.frontend.lexer.Lexer;
import org.exprcalc.engine.frontend.lexer.Token;
import org.exprcalc.engine.frontend.parser.Parser;
import org.exprcalc.engine.frontend.parser.ast.AstNode;
import org.exprcalc.engine.util.AstPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * The main calculator implementation. This class runs the pipeline from an input line to
 * a value: lexing, parsing and evaluation. Each call is independent; the calculator holds
 * no state besides its options and is safe to share between threads.
 */
public class Calculator implements ICalculator {

    private static final Logger log = LoggerFactory.getLogger(Calculator.class);

    private final CalculatorOptions options;
    private final Evaluator evaluator;

    /**
     * Creates a calculator with the default options.
     */
    public Calculator() {
        this(CalculatorOptions.defaults());
    }

    /**
     * Creates a calculator.
     * @param options The limits and arithmetic policies to apply.
     */
    public Calculator(CalculatorOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.evaluator = new Evaluator(options.floatZeroDivisorPolicy());
    }

    public CalculatorOptions getOptions() {
        return options;
    }

    @Override
    public List<Token> tokenize(String input) throws CalculationException {
        Objects.requireNonNull(input, "input");
        if (input.length() > options.maxInputLength()) {
            throw new LexException(CalculatorErrorCode.INPUT_TOO_LONG,
                    "input of " + input.length() + " characters exceeds the limit of " + options.maxInputLength(),
                    options.maxInputLength());
        }

        // Phase 1: Lexical Analysis
        List<Token> tokens = new Lexer(input).scanTokens();
        log.debug("Lexed {} tokens from '{}'.", tokens.size(), input);
        return tokens;
    }

    @Override
    public AstNode parse(String input) throws CalculationException {
        List<Token> tokens = tokenize(input);

        // Phase 2: Parsing (builds AST)
        AstNode ast = new Parser(tokens, options.maxNestingDepth()).parse();
        if (log.isDebugEnabled()) {
            log.debug("Parsed '{}' into {}.", input, AstPrinter.renderInfix(ast));
        }
        return ast;
    }

    @Override
    public NumericValue evaluate(AstNode ast) throws CalculationException {
        Objects.requireNonNull(ast, "ast");

        // Phase 3: Evaluation
        NumericValue value = evaluator.evaluate(ast);
        log.debug("Evaluated to {}.", value);
        return value;
    }
}
