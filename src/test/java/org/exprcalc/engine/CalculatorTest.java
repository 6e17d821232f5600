package org.exprcalc.engine;

import org.exprcalc.engine.api.CalculationException;
import org.exprcalc.engine.api.CalculatorErrorCode;
import org.exprcalc.engine.api.EvaluationException;
import org.exprcalc.engine.api.LexException;
import org.exprcalc.engine.api.NumericValue;
import org.exprcalc.engine.api.ParseException;
import org.exprcalc.engine.evaluator.ZeroDivisorPolicy;
import org.exprcalc.engine.frontend.lexer.Token;
import org.exprcalc.engine.frontend.lexer.TokenType;
import org.exprcalc.engine.frontend.parser.Parser;
import org.exprcalc.engine.frontend.parser.ast.AstNode;
import org.exprcalc.engine.util.AstPrinter;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * End-to-end tests of the calculator pipeline: input line in, value or categorized error out.
 */
@Tag("unit")
public class CalculatorTest {

    private final Calculator calculator = new Calculator();

    private CalculationException failure(Calculator target, String input) {
        Throwable thrown = catchThrowable(() -> target.calculate(input));
        assertThat(thrown).isInstanceOf(CalculationException.class);
        return (CalculationException) thrown;
    }

    @Test
    void testCalculatesIntegerExpressions() throws CalculationException {
        assertThat(calculator.calculate("2 + 3 * 4")).isEqualTo(NumericValue.of(14));
        assertThat(calculator.calculate("(2 + 3) * 4")).isEqualTo(NumericValue.of(20));
        assertThat(calculator.calculate("2 ^ 3 ^ 2")).isEqualTo(NumericValue.of(512));
        assertThat(calculator.calculate("-2 ^ 2")).isEqualTo(NumericValue.of(-4));
        assertThat(calculator.calculate("7 % 3")).isEqualTo(NumericValue.of(1));
        assertThat(calculator.calculate("7 / 2")).isEqualTo(NumericValue.of(3));
        assertThat(calculator.calculate("-3 + 5")).isEqualTo(NumericValue.of(2));
        assertThat(calculator.calculate("1 - 2 - 3")).isEqualTo(NumericValue.of(-4));
        assertThat(calculator.calculate("  42  ")).isEqualTo(NumericValue.of(42));
    }

    @Test
    void testCalculatesFloatingPointExpressions() throws CalculationException {
        NumericValue result = calculator.calculate("7.0 / 2");

        assertThat(result).isEqualTo(NumericValue.of(3.5));
        assertThat(result.toString()).isEqualTo("3.5");
        assertThat(calculator.calculate("1 + 1.0").toString()).isEqualTo("2.0");
    }

    @Test
    void testErrorsAreCategorizedByStage() {
        CalculationException lex = failure(calculator, "2 $ 3");
        CalculationException parse = failure(calculator, "(1 + 2");
        CalculationException evaluation = failure(calculator, "1 / 0");

        assertThat(lex).isInstanceOf(LexException.class);
        assertThat(lex.getErrorCode().stage()).isEqualTo(CalculatorErrorCode.Stage.LEXER);
        assertThat(lex.getPosition()).isEqualTo(2);
        assertThat(parse).isInstanceOf(ParseException.class);
        assertThat(parse.getErrorCode().stage()).isEqualTo(CalculatorErrorCode.Stage.PARSER);
        assertThat(evaluation).isInstanceOf(EvaluationException.class);
        assertThat(evaluation.getErrorCode().stage()).isEqualTo(CalculatorErrorCode.Stage.EVALUATOR);
    }

    @Test
    void testReportsSpecificErrorCodes() {
        assertThat(failure(calculator, "1.2.3").getErrorCode()).isEqualTo(CalculatorErrorCode.MALFORMED_NUMBER);
        assertThat(failure(calculator, "7 % 0").getErrorCode()).isEqualTo(CalculatorErrorCode.MODULO_BY_ZERO);
        assertThat(failure(calculator, "9223372036854775807 + 1").getErrorCode())
                .isEqualTo(CalculatorErrorCode.ARITHMETIC_OVERFLOW);
        assertThat(failure(calculator, "").getErrorCode()).isEqualTo(CalculatorErrorCode.UNEXPECTED_TOKEN);
        assertThat(failure(calculator, "1 2").getErrorCode()).isEqualTo(CalculatorErrorCode.TRAILING_TOKENS);
    }

    @Test
    void testTokenizeExposesTheTokenStream() throws CalculationException {
        List<Token> tokens = calculator.tokenize("1+2");

        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.NUMBER, TokenType.PLUS, TokenType.NUMBER, TokenType.END_OF_INPUT);
    }

    @Test
    void testParseAndEvaluateCanBeCalledSeparately() throws CalculationException {
        AstNode ast = calculator.parse("(1 + 2) * 3");

        assertThat(AstPrinter.renderInfix(ast)).isEqualTo("(1 + 2) * 3");
        assertThat(calculator.evaluate(ast)).isEqualTo(NumericValue.of(9));
    }

    @Test
    void testRejectsInputLongerThanTheLimit() {
        Calculator small = new Calculator(new CalculatorOptions(16, 8, ZeroDivisorPolicy.IEEE));

        CalculationException e = failure(small, "1 + 2 + 3");

        assertThat(e).isInstanceOf(LexException.class);
        assertThat(e.getErrorCode()).isEqualTo(CalculatorErrorCode.INPUT_TOO_LONG);
        assertThat(e.getPosition()).isEqualTo(8);
    }

    @Test
    void testDefaultInputLimit() {
        String longInput = "1" + "+1".repeat(CalculatorOptions.DEFAULT_MAX_INPUT_LENGTH / 2);

        assertThat(failure(calculator, longInput).getErrorCode()).isEqualTo(CalculatorErrorCode.INPUT_TOO_LONG);
    }

    @Test
    void testCalculatesChainsUpToTheLargestInputLimit() throws CalculationException {
        Calculator roomy = new Calculator(new CalculatorOptions(
                Parser.DEFAULT_MAX_NESTING_DEPTH, CalculatorOptions.MAX_INPUT_LENGTH_LIMIT, ZeroDivisorPolicy.IEEE));
        String input = "1" + "+1".repeat((CalculatorOptions.MAX_INPUT_LENGTH_LIMIT - 1) / 2);

        assertThat(roomy.calculate(input)).isEqualTo(NumericValue.of(32768));
    }

    @Test
    void testAppliesNestingLimitFromOptions() throws CalculationException {
        Calculator shallow = new Calculator(new CalculatorOptions(2, 100, ZeroDivisorPolicy.IEEE));

        assertThat(shallow.calculate("((1))")).isEqualTo(NumericValue.of(1));
        assertThat(failure(shallow, "(((1)))").getErrorCode()).isEqualTo(CalculatorErrorCode.NESTING_TOO_DEEP);
    }

    @Test
    void testAppliesFloatZeroDivisorPolicyFromOptions() throws CalculationException {
        Calculator strict = new Calculator(new CalculatorOptions(16, 100, ZeroDivisorPolicy.ERROR));

        assertThat(calculator.calculate("1.0 / 0")).isEqualTo(NumericValue.of(Double.POSITIVE_INFINITY));
        assertThat(failure(strict, "1.0 / 0").getErrorCode()).isEqualTo(CalculatorErrorCode.DIVISION_BY_ZERO);
    }

    @Test
    void testCallsAreIndependent() throws CalculationException {
        failure(calculator, "1 / 0");

        assertThat(calculator.calculate("1 + 1")).isEqualTo(NumericValue.of(2));
    }

    @Test
    void testRejectsNullInput() {
        assertThatThrownBy(() -> calculator.calculate(null)).isInstanceOf(NullPointerException.class);
    }
}
