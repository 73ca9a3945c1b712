package com.wflint.syntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Node of a parsed {@code ${{ }}} expression.
 * <p>
 * The set of node shapes is closed. Consumers dispatch with an {@code instanceof}
 * chain covering every record below and end it with an {@link IllegalStateException},
 * see {@link ExprNodeWalker#children(ExprNode)}.
 * <p>
 * Nodes are immutable and compare structurally. Parentheses are never
 * represented.
 */
public sealed interface ExprNode {

    /**
     * Comparison operators.
     */
    enum CompareOpKind {
        LESS("<"),
        LESS_EQ("<="),
        GREATER(">"),
        GREATER_EQ(">="),
        EQ("=="),
        NOT_EQ("!=");

        private final String symbol;

        CompareOpKind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /**
     * Short-circuit logical operators.
     */
    enum LogicalOpKind {
        AND("&&"),
        OR("||");

        private final String symbol;

        LogicalOpKind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    // Literals

    /**
     * {@code null}
     */
    record NullNode() implements ExprNode {
    }

    /**
     * {@code true} or {@code false}
     */
    record BoolNode(boolean value) implements ExprNode {
    }

    /**
     * Integer literal, decimal or hexadecimal.
     */
    record IntNode(long value) implements ExprNode {
    }

    /**
     * Number literal with a fraction or an exponent part.
     */
    record FloatNode(double value) implements ExprNode {
    }

    /**
     * Single-quoted string literal with escapes already resolved.
     */
    record StringNode(String value) implements ExprNode {
        public StringNode {
            Objects.requireNonNull(value, "value");
        }
    }

    // References

    /**
     * Bare identifier such as {@code github} or {@code matrix}.
     */
    record VariableNode(String name) implements ExprNode {
        public VariableNode {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * {@code receiver.property}
     */
    record ObjectDerefNode(ExprNode receiver, String property) implements ExprNode {
        public ObjectDerefNode {
            Objects.requireNonNull(receiver, "receiver");
            Objects.requireNonNull(property, "property");
        }
    }

    /**
     * {@code receiver.*}
     */
    record ArrayDerefNode(ExprNode receiver) implements ExprNode {
        public ArrayDerefNode {
            Objects.requireNonNull(receiver, "receiver");
        }
    }

    /**
     * {@code receiver[index]}
     */
    record IndexAccessNode(ExprNode receiver, ExprNode index) implements ExprNode {
        public IndexAccessNode {
            Objects.requireNonNull(receiver, "receiver");
            Objects.requireNonNull(index, "index");
        }
    }

    // Operators

    /**
     * {@code !operand}
     */
    record NotOpNode(ExprNode operand) implements ExprNode {
        public NotOpNode {
            Objects.requireNonNull(operand, "operand");
        }
    }

    record CompareOpNode(CompareOpKind kind, ExprNode left, ExprNode right) implements ExprNode {
        public CompareOpNode {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record LogicalOpNode(LogicalOpKind kind, ExprNode left, ExprNode right) implements ExprNode {
        public LogicalOpNode {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    /**
     * {@code name(arg, ...)}. Arguments keep source order.
     */
    record FuncCallNode(String name, List<ExprNode> args) implements ExprNode {
        public FuncCallNode {
            Objects.requireNonNull(name, "name");
            args = List.copyOf(args);
        }
    }
}
