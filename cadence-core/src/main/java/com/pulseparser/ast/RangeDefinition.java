package com.pulseparser.ast;

/**
 * {@code [start:end]} or {@code [start:end:step]}; {@code step} is {@code null} when omitted.
 */
public record RangeDefinition(
    Span span,
    Expression start,
    Expression end,
    Expression step
) implements SetDeclaration {
    public RangeDefinition(Expression start, Expression end, Expression step) {
        this(null, start, end, step);
    }

    @Override
    public String kind() {
        return "RangeDefinition";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
