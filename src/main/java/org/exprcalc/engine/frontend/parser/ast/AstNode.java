package org.exprcalc.engine.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * The set of node kinds is closed. Nodes are immutable records, so two trees are
 * structurally equal exactly when they are {@link Object#equals(Object) equal}.
 */
public sealed interface AstNode permits NumberLiteralNode, UnaryOpNode, BinaryOpNode {

    /**
     * Returns a list of the direct child nodes, left to right.
     * This allows generic traversals (printing, depth checks) without knowing
     * the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Returns the label of this node as shown by the tree printer.
     *
     * @return The operator symbol or the literal value.
     */
    String label();
}
