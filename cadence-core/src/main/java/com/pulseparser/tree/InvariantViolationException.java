package com.pulseparser.tree;

import com.pulseparser.ast.Span;

/**
 * A tree that should be complete is not: some node lacks its span. This points at a
 * defect in a grammar rule, never at a problem with the parsed source.
 */
public class InvariantViolationException extends IllegalStateException {
    private final String nodeKind;
    private final Span ancestorSpan;

    public InvariantViolationException(String nodeKind, Span ancestorSpan) {
        super("The span of " + nodeKind + " is null"
            + (ancestorSpan != null ? " (nearest ancestor span " + ancestorSpan + ")" : ""));
        this.nodeKind = nodeKind;
        this.ancestorSpan = ancestorSpan;
    }

    public String getNodeKind() {
        return nodeKind;
    }

    /**
     * Span of the closest enclosing node that has one, or {@code null}.
     */
    public Span getAncestorSpan() {
        return ancestorSpan;
    }
}
