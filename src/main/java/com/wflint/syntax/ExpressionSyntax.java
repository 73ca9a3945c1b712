package com.wflint.syntax;

import com.wflint.exception.ExpressionLexException;
import com.wflint.syntax.ast.ExprNode;
import com.wflint.syntax.expression.ExpressionLexer;
import com.wflint.syntax.expression.ExpressionParser;
import com.wflint.syntax.expression.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.wflint.syntax.expression.ExpressionConfig.EXPRESSION_END;
import static com.wflint.syntax.expression.ExpressionConfig.EXPRESSION_START;

/**
 * Facade for parsing workflow expressions into {@link ExprNode} trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Literals: null, true, false, integers (decimal and hex), floats, 'strings'</li>
 *   <li>Variables and dereferences: a.b, a.*, a[expr]</li>
 *   <li>Function calls: name(arg, ...)</li>
 *   <li>Operators: !, ==, !=, &lt;, &lt;=, &gt;, &gt;=, &amp;&amp;, ||</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * All methods are stateless and safe to call from any thread.
 */
public final class ExpressionSyntax {

    private static final Logger log = LoggerFactory.getLogger(ExpressionSyntax.class);

    private ExpressionSyntax() {
    }

    /**
     * Parse the interior of one expression. A trailing {@code }}} and anything
     * after it is ignored.
     *
     * @param expression Expression text, e.g. {@code github.event_name == 'push'}
     * @return Parsed expression
     * @throws com.wflint.exception.ExpressionSyntaxException if the expression is malformed
     */
    public static ExprNode parse(String expression) {
        Objects.requireNonNull(expression, "expression");

        // Tokenize
        List<Token> tokens = new ExpressionLexer(expression).tokenize();

        // Parse
        return new ExpressionParser(expression, tokens).parse();
    }

    /**
     * Find and parse every {@code ${{ }}} placeholder in a workflow string.
     * A {@code }}} inside a string literal does not close the placeholder.
     *
     * @param text Workflow string value, e.g. {@code "echo ${{ matrix.os }}"}
     * @return Placeholders in order of appearance, empty when there is none
     * @throws ExpressionLexException if a placeholder is not closed
     * @throws com.wflint.exception.ExpressionSyntaxException if a placeholder is malformed
     */
    public static List<EmbeddedExpression> parseTemplate(String text) {
        Objects.requireNonNull(text, "text");
        List<EmbeddedExpression> expressions = new ArrayList<>();
        int from = 0;

        while (true) {
            int start = text.indexOf(EXPRESSION_START, from);
            if (start < 0) {
                break;
            }

            int interior = start + EXPRESSION_START.length();
            List<Token> tokens = new ExpressionLexer(text, interior).tokenize();
            Token eof = tokens.get(tokens.size() - 1);
            if (!EXPRESSION_END.equals(eof.text())) {
                throw new ExpressionLexException(text, start,
                        "Placeholder '" + EXPRESSION_START + "' is not closed with '" + EXPRESSION_END + "'");
            }

            ExprNode node = new ExpressionParser(text, tokens).parse();
            int end = eof.offset() + EXPRESSION_END.length();
            expressions.add(new EmbeddedExpression(start, end, text.substring(interior, eof.offset()).strip(), node));
            from = end;
        }

        log.debug("Found {} expression(s) in '{}'", expressions.size(), text);
        return expressions;
    }
}
