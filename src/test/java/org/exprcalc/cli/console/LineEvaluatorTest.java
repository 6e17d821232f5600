package org.exprcalc.cli.console;

import org.exprcalc.engine.Calculator;
import org.exprcalc.engine.api.CalculatorErrorCode;
import org.exprcalc.engine.api.EvaluationException;
import org.exprcalc.engine.api.ICalculator;
import org.exprcalc.engine.api.NumericValue;
import org.exprcalc.engine.api.ParseException;
import org.exprcalc.engine.frontend.parser.ast.AstNode;
import org.exprcalc.engine.frontend.parser.ast.NumberLiteralNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class LineEvaluatorTest {

    @Mock
    private ICalculator calculator;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private LineEvaluator evaluatorFor(ICalculator target, ConsoleOptions options) {
        return new LineEvaluator(target, options, new PrintWriter(out), new PrintWriter(err));
    }

    @Test
    void evaluate_printsResultWithOutputPrefix() {
        // Arrange
        LineEvaluator evaluator = evaluatorFor(new Calculator(), ConsoleOptions.defaults());

        // Act
        boolean success = evaluator.evaluate("2 + 3 * 4");

        // Assert
        assertThat(success).isTrue();
        assertThat(out.toString()).isEqualTo("out> 14" + System.lineSeparator());
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void evaluate_printsErrorWithErrorPrefix() {
        LineEvaluator evaluator = evaluatorFor(new Calculator(), ConsoleOptions.defaults());

        boolean success = evaluator.evaluate("2 $ 3");

        assertThat(success).isFalse();
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).isEqualTo("err> unknown character '$' at position 2" + System.lineSeparator());
    }

    @Test
    void evaluate_printsTreeBeforeResultWhenEnabled() {
        LineEvaluator evaluator = evaluatorFor(new Calculator(), ConsoleOptions.defaults().withShowTree(true));

        evaluator.evaluate("7");

        assertThat(out.toString().lines()).containsExactly(
                "ast>",
                "└┬────┐",
                " │  7 │",
                " └────┘",
                "out> 7");
    }

    @Test
    void evaluate_keepsTreeWhenEvaluationFails() throws Exception {
        // Arrange
        AstNode ast = new NumberLiteralNode(NumericValue.of(1));
        when(calculator.parse("1 / 0")).thenReturn(ast);
        when(calculator.evaluate(ast)).thenThrow(
                new EvaluationException(CalculatorErrorCode.DIVISION_BY_ZERO, "division by zero: 1 / 0"));
        LineEvaluator evaluator = evaluatorFor(calculator, ConsoleOptions.defaults().withShowTree(true));

        // Act
        boolean success = evaluator.evaluate("1 / 0");

        // Assert
        assertThat(success).isFalse();
        assertThat(out.toString()).startsWith("ast>").doesNotContain("out>");
        assertThat(err.toString()).contains("err> division by zero: 1 / 0");
    }

    @Test
    void evaluate_doesNotEvaluateWhenParsingFails() throws Exception {
        when(calculator.parse("(")).thenThrow(
                new ParseException(CalculatorErrorCode.UNEXPECTED_TOKEN, "unexpected end of input", 1));
        LineEvaluator evaluator = evaluatorFor(calculator, ConsoleOptions.defaults());

        evaluator.evaluate("(");

        verify(calculator, never()).evaluate(any());
        assertThat(err.toString()).contains("err> unexpected end of input");
    }

    @Test
    void evaluate_usesConfiguredPrefixes() {
        ConsoleOptions options = new ConsoleOptions("> ", "tree:", "= ", "! ", false, List.of("bye"));
        LineEvaluator evaluator = evaluatorFor(new Calculator(), options);

        evaluator.evaluate("6 * 7");
        evaluator.evaluate("6 /");

        assertThat(out.toString()).startsWith("= 42");
        assertThat(err.toString()).startsWith("! ");
    }
}
