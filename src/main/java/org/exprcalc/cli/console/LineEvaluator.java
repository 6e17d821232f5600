package org.exprcalc.cli.console;

import org.exprcalc.engine.api.CalculationException;
import org.exprcalc.engine.api.ICalculator;
import org.exprcalc.engine.api.NumericValue;
import org.exprcalc.engine.frontend.parser.ast.AstNode;
import org.exprcalc.engine.util.AstPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;

/**
 * Calculates one input line and writes the outcome: the optional tree, then either
 * {@code out> value} to the output writer or {@code err> message} to the error writer.
 */
public class LineEvaluator {

    private static final Logger log = LoggerFactory.getLogger(LineEvaluator.class);

    private final ICalculator calculator;
    private final ConsoleOptions options;
    private final PrintWriter out;
    private final PrintWriter err;

    public LineEvaluator(ICalculator calculator, ConsoleOptions options, PrintWriter out, PrintWriter err) {
        this.calculator = calculator;
        this.options = options;
        this.out = out;
        this.err = err;
    }

    /**
     * Calculates the given line.
     * @param line The trimmed, non-empty input line.
     * @return {@code true} if a result was printed, {@code false} if an error was reported.
     */
    public boolean evaluate(String line) {
        try {
            AstNode ast = calculator.parse(line);
            if (options.showTree()) {
                out.println(options.treeHeader());
                out.print(AstPrinter.renderTree(ast));
            }
            NumericValue value = calculator.evaluate(ast);
            out.println(options.outputPrefix() + value);
            return true;
        } catch (CalculationException e) {
            log.debug("Calculation of '{}' failed with {} ({} stage).", line, e.getErrorCode(), e.getErrorCode().stage());
            err.println(options.errorPrefix() + e.getMessage());
            return false;
        } finally {
            out.flush();
            err.flush();
        }
    }
}
