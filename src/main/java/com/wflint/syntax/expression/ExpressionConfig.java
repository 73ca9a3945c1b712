package com.wflint.syntax.expression;

import com.wflint.syntax.ast.ExprNode;
import com.wflint.syntax.ast.ExprNode.CompareOpKind;

import java.util.Map;

/**
 * Keywords and operator symbols of the expression syntax.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Identifiers the parser turns into literals. Matched case-sensitively.
     */
    public static final Map<String, ExprNode> KEYWORDS = Map.of(
            "true", new ExprNode.BoolNode(true),
            "false", new ExprNode.BoolNode(false),
            "null", new ExprNode.NullNode()
    );

    /**
     * Comparison token types mapped to node kinds.
     */
    public static final Map<TokenType, CompareOpKind> COMPARE_OPERATORS = Map.of(
            TokenType.LT, CompareOpKind.LESS,
            TokenType.LTE, CompareOpKind.LESS_EQ,
            TokenType.GT, CompareOpKind.GREATER,
            TokenType.GTE, CompareOpKind.GREATER_EQ,
            TokenType.EQ, CompareOpKind.EQ,
            TokenType.NE, CompareOpKind.NOT_EQ
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char RIGHT_BRACE = '}';
        public static final char COMMA = ',';
        public static final char DOT = '.';
        public static final char STAR = '*';
        public static final char EQUALS = '=';
        public static final char BANG = '!';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char AMPERSAND = '&';
        public static final char PIPE = '|';
        public static final char QUOTE = '\'';
        public static final char MINUS = '-';
        public static final char PLUS = '+';
        public static final char UNDERSCORE = '_';

        private Operators() {
        }
    }

    /**
     * Marker opening an embedded expression in a workflow string.
     */
    public static final String EXPRESSION_START = "${{";

    /**
     * Marker closing an embedded expression. The lexer stops in front of it.
     */
    public static final String EXPRESSION_END = "}}";
}
