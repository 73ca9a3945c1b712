package com.wflint.syntax.expression;

/**
 * Token types for expression parsing.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT("identifier"),
    STRING("string"),
    INT("integer"),
    FLOAT("float"),

    // Delimiters
    LPAREN("'('"),
    RPAREN("')'"),
    LBRACKET("'['"),
    RBRACKET("']'"),
    DOT("'.'"),
    STAR("'*'"),
    COMMA("','"),

    // Logical operators
    NOT("'!'"),
    AND("'&&'"),
    OR("'||'"),

    // Comparison operators
    EQ("'=='"),
    NE("'!='"),
    GT("'>'"),
    GTE("'>='"),
    LT("'<'"),
    LTE("'<='"),

    // Special
    EOF("end of input");

    private final String description;

    TokenType(String description) {
        this.description = description;
    }

    /**
     * Human readable name used in error messages.
     */
    public String description() {
        return description;
    }
}
