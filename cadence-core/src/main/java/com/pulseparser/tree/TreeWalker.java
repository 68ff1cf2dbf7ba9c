package com.pulseparser.tree;

import com.pulseparser.ast.Node;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Pre-order walk over a tree. {@link #visitNode} is called for a node before any of
 * its children; children are visited in the order {@link NodeChildren} lists them, so
 * every node reachable from the root is visited exactly once in a fixed order.
 *
 * <p>Instances keep the ancestor stack of the walk in progress and must not be shared
 * between threads.</p>
 */
public abstract class TreeWalker {
    private final Deque<Node> ancestors = new ArrayDeque<>();

    public final void walk(Node root) {
        ancestors.clear();
        descend(root);
    }

    private void descend(Node node) {
        visitNode(node, ancestors);
        ancestors.push(node);
        try {
            for (Node child : NodeChildren.of(node)) {
                descend(child);
            }
        } finally {
            ancestors.pop();
        }
    }

    /**
     * @param node      the node being visited
     * @param ancestors enclosing nodes, nearest first; empty for the root
     */
    protected abstract void visitNode(Node node, Deque<Node> ancestors);
}
