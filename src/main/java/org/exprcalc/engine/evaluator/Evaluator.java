package org.exprcalc.engine.evaluator;

import org.exprcalc.engine.api.CalculatorErrorCode;
import org.exprcalc.engine.api.EvaluationException;
import org.exprcalc.engine.api.NumericValue;
import org.exprcalc.engine.api.NumericValue.IntegerValue;
import org.exprcalc.engine.frontend.parser.ast.AstNode;
import org.exprcalc.engine.frontend.parser.ast.BinaryOpNode;
import org.exprcalc.engine.frontend.parser.ast.BinaryOperator;
import org.exprcalc.engine.frontend.parser.ast.NumberLiteralNode;
import org.exprcalc.engine.frontend.parser.ast.UnaryOpNode;
import org.exprcalc.engine.frontend.parser.ast.UnaryOperator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongBinaryOperator;

/**
 * Computes the value of an AST. Evaluation is a pure fold over the tree:
 * both operands of a binary node are evaluated, left before right, before they are combined.
 * <p>
 * Two integer operands produce an exact integer result; integer overflow is an error, never
 * a wrap-around. If either operand is floating point, the operation is carried out on doubles.
 * Instances are immutable and may be shared.
 */
public class Evaluator {

    private final ZeroDivisorPolicy floatZeroDivisorPolicy;

    /**
     * Creates an evaluator that follows IEEE 754 for floating point zero divisors.
     */
    public Evaluator() {
        this(ZeroDivisorPolicy.IEEE);
    }

    /**
     * Creates an evaluator.
     * @param floatZeroDivisorPolicy How floating point division and modulo treat a zero divisor.
     */
    public Evaluator(ZeroDivisorPolicy floatZeroDivisorPolicy) {
        this.floatZeroDivisorPolicy = floatZeroDivisorPolicy;
    }

    /**
     * Evaluates the given tree.
     * @param node The root of the tree.
     * @return The value of the expression.
     * @throws EvaluationException on a zero divisor or an integer overflow.
     */
    public NumericValue evaluate(AstNode node) throws EvaluationException {
        if (node instanceof NumberLiteralNode literal) {
            return literal.value();
        }
        if (node instanceof UnaryOpNode unary) {
            NumericValue operand = evaluate(unary.operand());
            return unary.operator() == UnaryOperator.NEGATE ? negate(operand) : operand;
        }
        if (node instanceof BinaryOpNode binary) {
            return evaluateChain(binary);
        }
        throw new IllegalStateException("Unknown AST node type: " + node.getClass().getName());
    }

    /**
     * Operator chains such as {@code 1 + 2 + 3} are left-deep and only bounded by the input length,
     * so the left spine is walked with an explicit stack. Right operands are bounded by the
     * parser's nesting limit and are evaluated recursively.
     */
    private NumericValue evaluateChain(BinaryOpNode top) throws EvaluationException {
        Deque<BinaryOpNode> spine = new ArrayDeque<>();
        AstNode current = top;
        while (current instanceof BinaryOpNode binary) {
            spine.push(binary);
            current = binary.left();
        }

        NumericValue result = evaluate(current);
        while (!spine.isEmpty()) {
            BinaryOpNode binary = spine.pop();
            NumericValue right = evaluate(binary.right());
            result = apply(binary.operator(), result, right);
        }
        return result;
    }

    private NumericValue apply(BinaryOperator op, NumericValue left, NumericValue right) throws EvaluationException {
        return switch (op) {
            case ADD -> arithmetic(op, left, right, Math::addExact);
            case SUBTRACT -> arithmetic(op, left, right, Math::subtractExact);
            case MULTIPLY -> arithmetic(op, left, right, Math::multiplyExact);
            case DIVIDE -> divide(left, right);
            case MODULO -> modulo(left, right);
            case POWER -> power(left, right);
        };
    }

    private NumericValue negate(NumericValue operand) throws EvaluationException {
        if (operand instanceof IntegerValue integer) {
            try {
                return NumericValue.of(Math.negateExact(integer.value()));
            } catch (ArithmeticException e) {
                throw overflow("-(" + integer + ")", e);
            }
        }
        return NumericValue.of(-operand.asDouble());
    }

    private NumericValue arithmetic(BinaryOperator op, NumericValue left, NumericValue right,
                                    LongBinaryOperator exact) throws EvaluationException {
        if (left instanceof IntegerValue a && right instanceof IntegerValue b) {
            return exact(op, a, b, exact);
        }
        double l = left.asDouble();
        double r = right.asDouble();
        return switch (op) {
            case ADD -> NumericValue.of(l + r);
            case SUBTRACT -> NumericValue.of(l - r);
            case MULTIPLY -> NumericValue.of(l * r);
            default -> throw new IllegalArgumentException("Not a ring operator: " + op);
        };
    }

    private NumericValue divide(NumericValue left, NumericValue right) throws EvaluationException {
        if (left instanceof IntegerValue a && right instanceof IntegerValue b) {
            if (b.isZero()) {
                throw new EvaluationException(CalculatorErrorCode.DIVISION_BY_ZERO, "division by zero: " + a + " / 0");
            }
            return exact(BinaryOperator.DIVIDE, a, b, (x, y) -> {
                if (x == Long.MIN_VALUE && y == -1) {
                    throw new ArithmeticException("long overflow");
                }
                return x / y;
            });
        }
        if (right.isZero() && floatZeroDivisorPolicy == ZeroDivisorPolicy.ERROR) {
            throw new EvaluationException(CalculatorErrorCode.DIVISION_BY_ZERO, "division by zero: " + left + " / " + right);
        }
        return NumericValue.of(left.asDouble() / right.asDouble());
    }

    private NumericValue modulo(NumericValue left, NumericValue right) throws EvaluationException {
        if (left instanceof IntegerValue a && right instanceof IntegerValue b) {
            if (b.isZero()) {
                throw new EvaluationException(CalculatorErrorCode.MODULO_BY_ZERO, "modulo by zero: " + a + " % 0");
            }
            return NumericValue.of(a.value() % b.value());
        }
        if (right.isZero() && floatZeroDivisorPolicy == ZeroDivisorPolicy.ERROR) {
            throw new EvaluationException(CalculatorErrorCode.MODULO_BY_ZERO, "modulo by zero: " + left + " % " + right);
        }
        return NumericValue.of(left.asDouble() % right.asDouble());
    }

    private NumericValue power(NumericValue left, NumericValue right) throws EvaluationException {
        if (left instanceof IntegerValue a && right instanceof IntegerValue b && b.value() >= 0) {
            return exact(BinaryOperator.POWER, a, b, Evaluator::exactPow);
        }
        return NumericValue.of(Math.pow(left.asDouble(), right.asDouble()));
    }

    private NumericValue exact(BinaryOperator op, IntegerValue a, IntegerValue b, LongBinaryOperator function)
            throws EvaluationException {
        try {
            return NumericValue.of(function.applyAsLong(a.value(), b.value()));
        } catch (ArithmeticException e) {
            throw overflow(a + " " + op.symbol() + " " + b, e);
        }
    }

    private static EvaluationException overflow(String expression, ArithmeticException cause) {
        return new EvaluationException(CalculatorErrorCode.ARITHMETIC_OVERFLOW,
                "integer overflow: " + expression + " does not fit into 64 bits", cause);
    }

    /**
     * Exponentiation by squaring with overflow detection. The base is only squared while
     * exponent bits remain, so an overflow always means the result itself overflows.
     */
    private static long exactPow(long base, long exponent) {
        long result = 1;
        while (exponent > 0) {
            if ((exponent & 1) == 1) {
                result = Math.multiplyExact(result, base);
            }
            exponent >>= 1;
            if (exponent > 0) {
                base = Math.multiplyExact(base, base);
            }
        }
        return result;
    }
}
