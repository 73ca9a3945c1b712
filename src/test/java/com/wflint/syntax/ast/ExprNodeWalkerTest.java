package com.wflint.syntax.ast;

import com.wflint.syntax.ExpressionSyntax;
import com.wflint.syntax.ast.ExprNode.FuncCallNode;
import com.wflint.syntax.ast.ExprNode.ObjectDerefNode;
import com.wflint.syntax.ast.ExprNode.VariableNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExprNodeWalker.
 */
class ExprNodeWalkerTest {

    private static String label(ExprNode node) {
        return node.getClass().getSimpleName();
    }

    @Test
    @DisplayName("Should enter nodes in source order and leave them after their children")
    void shouldVisitDepthFirst() {
        ExprNode root = ExpressionSyntax.parse("a.b[c] && f(1, 'x')");
        List<String> events = new ArrayList<>();

        ExprNodeWalker.walk(root, new ExprNodeVisitor() {
            @Override
            public void enter(ExprNode node, ExprNode parent) {
                events.add("+" + label(node));
            }

            @Override
            public void leave(ExprNode node, ExprNode parent) {
                events.add("-" + label(node));
            }
        });

        assertEquals(List.of(
                "+LogicalOpNode",
                "+IndexAccessNode",
                "+ObjectDerefNode", "+VariableNode", "-VariableNode", "-ObjectDerefNode",
                "+VariableNode", "-VariableNode",
                "-IndexAccessNode",
                "+FuncCallNode",
                "+IntNode", "-IntNode",
                "+StringNode", "-StringNode",
                "-FuncCallNode",
                "-LogicalOpNode"
        ), events);
    }

    @Test
    @DisplayName("Should pass the enclosing node as parent")
    void shouldPassParent() {
        ExprNode root = ExpressionSyntax.parse("!contains(github.ref, 'v')");
        Map<ExprNode, ExprNode> parents = new IdentityHashMap<>();
        List<ExprNode> visited = new ArrayList<>();

        ExprNodeWalker.walk(root, (node, parent) -> {
            visited.add(node);
            parents.put(node, parent);
        });

        assertEquals(5, visited.size());
        assertNull(parents.get(root));
        for (ExprNode node : visited) {
            for (ExprNode child : ExprNodeWalker.children(node)) {
                assertSame(node, parents.get(child));
            }
        }
    }

    @Test
    @DisplayName("Should collect variables referenced by an expression")
    void shouldCollectVariables() {
        ExprNode root = ExpressionSyntax.parse("matrix.os == 'linux' && (env.CI || inputs.force)");
        List<String> names = new ArrayList<>();

        ExprNodeWalker.walk(root, (node, parent) -> {
            if (node instanceof VariableNode variable) {
                names.add(variable.name());
            }
        });

        assertEquals(List.of("matrix", "env", "inputs"), names);
    }

    @Test
    @DisplayName("Should walk a long chain without recursion")
    void shouldWalkLongChain() {
        ExprNode node = new VariableNode("a");
        for (int i = 0; i < 100_000; i++) {
            node = new ObjectDerefNode(node, "p");
        }
        int[] count = {0};

        ExprNodeWalker.walk(node, (n, parent) -> count[0]++);

        assertEquals(100_001, count[0]);
    }

    @Test
    @DisplayName("Should list call arguments as children")
    void shouldListCallArguments() {
        FuncCallNode call = (FuncCallNode) ExpressionSyntax.parse("format('{0}', a, b)");

        assertEquals(call.args(), ExprNodeWalker.children(call));
        assertEquals(3, ExprNodeWalker.children(call).size());
        assertTrue(ExprNodeWalker.children(call.args().get(1)).isEmpty());
    }
}
