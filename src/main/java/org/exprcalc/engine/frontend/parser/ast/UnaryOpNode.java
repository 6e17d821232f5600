package org.exprcalc.engine.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * An AST node that represents a prefix operator applied to a single operand, e.g. "-3".
 *
 * @param operator The unary operator.
 * @param operand The operand.
 */
public record UnaryOpNode(
        UnaryOperator operator,
        AstNode operand
) implements AstNode {

    public UnaryOpNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public String label() {
        return "u" + operator.symbol();
    }
}
