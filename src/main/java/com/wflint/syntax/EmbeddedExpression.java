package com.wflint.syntax;

import com.wflint.syntax.ast.ExprNode;

/**
 * An expression found inside a {@code ${{ }}} placeholder of a workflow string.
 *
 * @param start  Offset of {@code $} of the opening marker
 * @param end    Offset just past the closing {@code }}}
 * @param source Expression text between the markers, without surrounding whitespace
 * @param node   Parsed expression
 */
public record EmbeddedExpression(int start, int end, String source, ExprNode node) {
}
