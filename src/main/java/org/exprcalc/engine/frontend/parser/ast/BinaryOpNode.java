package org.exprcalc.engine.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * An AST node that represents an infix operator applied to two operands, e.g. "2 * 3".
 *
 * @param operator The binary operator.
 * @param left The left operand.
 * @param right The right operand.
 */
public record BinaryOpNode(
        BinaryOperator operator,
        AstNode left,
        AstNode right
) implements AstNode {

    public BinaryOpNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public String label() {
        return operator.symbol();
    }
}
