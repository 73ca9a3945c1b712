package com.wflint.syntax.ast;

import com.wflint.syntax.ast.ExprNode.ArrayDerefNode;
import com.wflint.syntax.ast.ExprNode.BoolNode;
import com.wflint.syntax.ast.ExprNode.CompareOpNode;
import com.wflint.syntax.ast.ExprNode.FloatNode;
import com.wflint.syntax.ast.ExprNode.FuncCallNode;
import com.wflint.syntax.ast.ExprNode.IndexAccessNode;
import com.wflint.syntax.ast.ExprNode.IntNode;
import com.wflint.syntax.ast.ExprNode.LogicalOpNode;
import com.wflint.syntax.ast.ExprNode.NotOpNode;
import com.wflint.syntax.ast.ExprNode.NullNode;
import com.wflint.syntax.ast.ExprNode.ObjectDerefNode;
import com.wflint.syntax.ast.ExprNode.StringNode;
import com.wflint.syntax.ast.ExprNode.VariableNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Depth-first traversal of an expression tree.
 * <p>
 * Children are visited in source order: receiver before property or index,
 * left operand before right operand, call arguments left to right. The walk
 * keeps its own stack, so long dereference chains do not grow the call stack.
 */
public final class ExprNodeWalker {

    private ExprNodeWalker() {
    }

    public static void walk(ExprNode root, ExprNodeVisitor visitor) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(visitor, "visitor");

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, null));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.entered) {
                stack.pop();
                visitor.leave(frame.node, frame.parent);
                continue;
            }

            frame.entered = true;
            visitor.enter(frame.node, frame.parent);

            List<ExprNode> children = children(frame.node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), frame.node));
            }
        }
    }

    /**
     * Direct children of a node in source order.
     */
    public static List<ExprNode> children(ExprNode node) {
        if (node instanceof NullNode
                || node instanceof BoolNode
                || node instanceof IntNode
                || node instanceof FloatNode
                || node instanceof StringNode
                || node instanceof VariableNode) {
            return List.of();
        }
        if (node instanceof ObjectDerefNode deref) {
            return List.of(deref.receiver());
        }
        if (node instanceof ArrayDerefNode deref) {
            return List.of(deref.receiver());
        }
        if (node instanceof IndexAccessNode access) {
            return List.of(access.receiver(), access.index());
        }
        if (node instanceof NotOpNode not) {
            return List.of(not.operand());
        }
        if (node instanceof CompareOpNode compare) {
            return List.of(compare.left(), compare.right());
        }
        if (node instanceof LogicalOpNode logical) {
            return List.of(logical.left(), logical.right());
        }
        if (node instanceof FuncCallNode call) {
            return call.args();
        }
        throw new IllegalStateException("Unknown expression node: " + node);
    }

    private static final class Frame {
        private final ExprNode node;
        private final ExprNode parent;
        private boolean entered;

        private Frame(ExprNode node, ExprNode parent) {
            this.node = node;
            this.parent = parent;
        }
    }
}
