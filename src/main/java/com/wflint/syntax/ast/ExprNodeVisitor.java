package com.wflint.syntax.ast;

/**
 * Callback for {@link ExprNodeWalker}.
 */
@FunctionalInterface
public interface ExprNodeVisitor {

    /**
     * Called before the children of {@code node} are visited.
     *
     * @param node   Visited node
     * @param parent Enclosing node, or {@code null} for the root
     */
    void enter(ExprNode node, ExprNode parent);

    /**
     * Called after all children of {@code node} were visited.
     */
    default void leave(ExprNode node, ExprNode parent) {
    }
}
