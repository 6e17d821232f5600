package org.exprcalc.engine.frontend.parser.ast;

import org.exprcalc.engine.api.NumericValue;

import java.util.Objects;

/**
 * An AST node that represents a numeric literal.
 *
 * @param value The value of the literal.
 */
public record NumberLiteralNode(
        NumericValue value
) implements AstNode {

    public NumberLiteralNode {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String label() {
        return value.toString();
    }

    // This node has no children and inherits the empty list from getChildren().
}
