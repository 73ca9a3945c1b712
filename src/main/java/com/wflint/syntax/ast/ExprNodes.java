package com.wflint.syntax.ast;

import com.wflint.syntax.ast.ExprNode.ArrayDerefNode;
import com.wflint.syntax.ast.ExprNode.BoolNode;
import com.wflint.syntax.ast.ExprNode.CompareOpNode;
import com.wflint.syntax.ast.ExprNode.FloatNode;
import com.wflint.syntax.ast.ExprNode.FuncCallNode;
import com.wflint.syntax.ast.ExprNode.IndexAccessNode;
import com.wflint.syntax.ast.ExprNode.IntNode;
import com.wflint.syntax.ast.ExprNode.LogicalOpKind;
import com.wflint.syntax.ast.ExprNode.LogicalOpNode;
import com.wflint.syntax.ast.ExprNode.NotOpNode;
import com.wflint.syntax.ast.ExprNode.NullNode;
import com.wflint.syntax.ast.ExprNode.ObjectDerefNode;
import com.wflint.syntax.ast.ExprNode.StringNode;
import com.wflint.syntax.ast.ExprNode.VariableNode;

/**
 * Renders expression trees back to canonical source text.
 * <p>
 * Parentheses are emitted only where precedence requires them, so the output
 * of {@code render(parse(s))} parses to the same tree as {@code s}.
 */
public final class ExprNodes {

    // Binding strength, lowest first.
    private static final int OR = 1;
    private static final int AND = 2;
    private static final int COMPARE = 3;
    private static final int NOT = 4;
    private static final int POSTFIX = 5;

    private ExprNodes() {
    }

    public static String render(ExprNode node) {
        StringBuilder sb = new StringBuilder();
        render(node, sb);
        return sb.toString();
    }

    private static void render(ExprNode node, StringBuilder sb) {
        if (node instanceof NullNode) {
            sb.append("null");
        } else if (node instanceof BoolNode bool) {
            sb.append(bool.value());
        } else if (node instanceof IntNode integer) {
            sb.append(integer.value());
        } else if (node instanceof FloatNode number) {
            sb.append(number.value());
        } else if (node instanceof StringNode string) {
            sb.append('\'').append(string.value().replace("'", "''")).append('\'');
        } else if (node instanceof VariableNode variable) {
            sb.append(variable.name());
        } else if (node instanceof ObjectDerefNode deref) {
            operand(deref.receiver(), POSTFIX, sb);
            sb.append('.').append(deref.property());
        } else if (node instanceof ArrayDerefNode deref) {
            operand(deref.receiver(), POSTFIX, sb);
            sb.append(".*");
        } else if (node instanceof IndexAccessNode access) {
            operand(access.receiver(), POSTFIX, sb);
            sb.append('[');
            render(access.index(), sb);
            sb.append(']');
        } else if (node instanceof NotOpNode not) {
            sb.append('!');
            operand(not.operand(), NOT, sb);
        } else if (node instanceof CompareOpNode compare) {
            binary(compare.left(), compare.kind().symbol(), compare.right(), COMPARE, sb);
        } else if (node instanceof LogicalOpNode logical) {
            int level = logical.kind() == LogicalOpKind.AND ? AND : OR;
            binary(logical.left(), logical.kind().symbol(), logical.right(), level, sb);
        } else if (node instanceof FuncCallNode call) {
            sb.append(call.name()).append('(');
            for (int i = 0; i < call.args().size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                render(call.args().get(i), sb);
            }
            sb.append(')');
        } else {
            throw new IllegalStateException("Unknown expression node: " + node);
        }
    }

    // Operators are left-associative, so an equal-precedence right operand needs parentheses.
    private static void binary(ExprNode left, String symbol, ExprNode right, int level, StringBuilder sb) {
        operand(left, level, sb);
        sb.append(' ').append(symbol).append(' ');
        operand(right, level + 1, sb);
    }

    private static void operand(ExprNode node, int minLevel, StringBuilder sb) {
        if (precedence(node) < minLevel) {
            sb.append('(');
            render(node, sb);
            sb.append(')');
        } else {
            render(node, sb);
        }
    }

    private static int precedence(ExprNode node) {
        if (node instanceof LogicalOpNode logical) {
            return logical.kind() == LogicalOpKind.AND ? AND : OR;
        }
        if (node instanceof CompareOpNode) {
            return COMPARE;
        }
        // A number directly followed by '.' would be lexed as part of the literal.
        if (node instanceof NotOpNode || node instanceof IntNode || node instanceof FloatNode) {
            return NOT;
        }
        return POSTFIX;
    }
}
