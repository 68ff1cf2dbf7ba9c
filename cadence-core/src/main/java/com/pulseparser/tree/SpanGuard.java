package com.pulseparser.tree;

import com.pulseparser.ast.Node;
import com.pulseparser.ast.Span;

import java.util.Deque;

/**
 * Checks that every node of a tree has a span. Fails on the first node, in pre-order,
 * whose span is missing.
 */
public final class SpanGuard extends TreeWalker {

    public static void check(Node root) {
        new SpanGuard().walk(root);
    }

    @Override
    protected void visitNode(Node node, Deque<Node> ancestors) {
        if (node.span() != null) {
            return;
        }
        Span ancestorSpan = null;
        for (Node ancestor : ancestors) {
            if (ancestor.span() != null) {
                ancestorSpan = ancestor.span();
                break;
            }
        }
        throw new InvariantViolationException(node.kind(), ancestorSpan);
    }
}
