package org.exprcalc.engine.util;

import org.exprcalc.engine.api.NumericValue;
import org.exprcalc.engine.frontend.parser.ast.AstNode;
import org.exprcalc.engine.frontend.parser.ast.BinaryOpNode;
import org.exprcalc.engine.frontend.parser.ast.BinaryOperator;
import org.exprcalc.engine.frontend.parser.ast.NumberLiteralNode;
import org.exprcalc.engine.frontend.parser.ast.UnaryOpNode;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Utility class for rendering an AST as text, for diagnostics only.
 */
public final class AstPrinter {

    /** Levels drawn by {@link #renderTree(AstNode)} before deeper subtrees are elided. */
    public static final int DEFAULT_MAX_TREE_DEPTH = 64;

    private AstPrinter() {}

    /**
     * Renders the tree with box-drawing characters, down to {@link #DEFAULT_MAX_TREE_DEPTH} levels.
     * Every node is drawn as a box holding its operator (left-aligned) or value (right-aligned);
     * children are indented below their parent.
     * <pre>
     * └┬────┐
     *  │ +  │
     *  └──┬─┘
     *     ├┬────┐
     *     ││  1 │
     *     │└────┘
     *     └┬────┐
     *      │  2 │
     *      └────┘
     * </pre>
     * @param root The root of the tree.
     * @return The rendered tree, one line per row, each terminated by a newline.
     */
    public static String renderTree(AstNode root) {
        return renderTree(root, DEFAULT_MAX_TREE_DEPTH);
    }

    /**
     * Renders the tree with box-drawing characters. A subtree below {@code maxDepth} is drawn
     * as a single {@code ...} line, which keeps the output linear in the number of nodes.
     * @param root The root of the tree.
     * @param maxDepth The deepest level drawn; the root is level 0.
     * @return The rendered tree, one line per row, each terminated by a newline.
     */
    public static String renderTree(AstNode root, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative, was " + maxDepth);
        }
        StringBuilder sb = new StringBuilder();
        appendTree(root, "", false, 0, maxDepth, sb);
        return sb.toString();
    }

    /**
     * Renders the tree as infix text with the fewest parentheses that keep its shape,
     * e.g. {@code 2 + 3 * 4} or {@code (2 + 3) * 4}. Lexing and parsing the result yields a tree
     * equal to the given one, as long as all literals are non-negative (which holds for every
     * tree built by the parser). The result never nests deeper than the text it was parsed from.
     * @param node The root of the tree.
     * @return The canonical infix form.
     */
    public static String renderInfix(AstNode node) {
        StringBuilder sb = new StringBuilder();
        appendInfix(node, sb);
        return sb.toString();
    }

    private static void appendTree(AstNode node, String prefix, boolean isLeft, int depth, int maxDepth, StringBuilder sb) {
        if (depth > maxDepth) {
            sb.append(prefix).append(isLeft ? "├" : "└").append(" ...\n");
            return;
        }
        List<AstNode> children = node.getChildren();
        boolean leaf = children.isEmpty();
        String label = node.label();
        int labelWidth = Math.max(label.length(), 2);
        int boxWidth = labelWidth + 2;
        String rail = isLeft ? "│" : " ";

        sb.append(prefix).append(isLeft ? "├" : "└").append('┬').append("─".repeat(boxWidth)).append("┐\n");
        sb.append(prefix).append(rail).append("│ ")
                .append(leaf ? padLeft(label, labelWidth) : padRight(label, labelWidth))
                .append(" │\n");
        if (leaf) {
            sb.append(prefix).append(rail).append('└').append("─".repeat(boxWidth)).append("┘\n");
            return;
        }
        sb.append(prefix).append(rail).append("└──┬").append("─".repeat(boxWidth - 3)).append("┘\n");

        String childPrefix = prefix + (isLeft ? "│   " : "    ");
        for (int i = 0; i < children.size(); i++) {
            appendTree(children.get(i), childPrefix, i < children.size() - 1, depth + 1, maxDepth, sb);
        }
    }

    private static void appendInfix(AstNode node, StringBuilder sb) {
        if (node instanceof NumberLiteralNode literal) {
            sb.append(formatLiteral(literal.value()));
        } else if (node instanceof UnaryOpNode unary) {
            sb.append(unary.operator().symbol());
            AstNode operand = unary.operand();
            appendOperand(operand, operand instanceof BinaryOpNode binary && binary.operator() != BinaryOperator.POWER, sb);
        } else if (node instanceof BinaryOpNode binary) {
            appendChain(binary, sb);
        }
    }

    /**
     * Left operands of the same tier print without parentheses, so a chain like {@code 1 + 2 - 3}
     * is collected iteratively instead of recursing once per operator.
     */
    private static void appendChain(BinaryOpNode top, StringBuilder sb) {
        Deque<BinaryOpNode> chain = new ArrayDeque<>();
        BinaryOpNode bottom = top;
        chain.push(bottom);
        while (bottom.operator() != BinaryOperator.POWER
                && bottom.left() instanceof BinaryOpNode left
                && left.operator().precedence() == bottom.operator().precedence()) {
            bottom = left;
            chain.push(bottom);
        }

        appendOperand(bottom.left(), needsParentheses(bottom, bottom.left(), true), sb);
        while (!chain.isEmpty()) {
            BinaryOpNode op = chain.pop();
            sb.append(' ').append(op.operator().symbol()).append(' ');
            appendOperand(op.right(), needsParentheses(op, op.right(), false), sb);
        }
    }

    private static boolean needsParentheses(BinaryOpNode parent, AstNode child, boolean isLeft) {
        BinaryOperator op = parent.operator();
        if (!(child instanceof BinaryOpNode binary)) {
            // A signed base would bind the sign to the whole power.
            return op == BinaryOperator.POWER && isLeft && child instanceof UnaryOpNode;
        }
        int childPrecedence = binary.operator().precedence();
        if (op == BinaryOperator.POWER) {
            return isLeft || childPrecedence < op.precedence();
        }
        return isLeft ? childPrecedence < op.precedence() : childPrecedence <= op.precedence();
    }

    private static void appendOperand(AstNode operand, boolean parenthesize, StringBuilder sb) {
        if (parenthesize) {
            sb.append('(');
            appendInfix(operand, sb);
            sb.append(')');
        } else {
            appendInfix(operand, sb);
        }
    }

    private static String formatLiteral(NumericValue value) {
        if (value instanceof NumericValue.FloatValue floating && Double.isFinite(floating.value())) {
            // The lexer reads neither exponents nor integral text as floating point.
            String plain = BigDecimal.valueOf(floating.value()).toPlainString();
            return plain.indexOf('.') >= 0 ? plain : plain + ".0";
        }
        return value.toString();
    }

    private static String padLeft(String s, int width) {
        return " ".repeat(width - s.length()) + s;
    }

    private static String padRight(String s, int width) {
        return s + " ".repeat(width - s.length());
    }
}
