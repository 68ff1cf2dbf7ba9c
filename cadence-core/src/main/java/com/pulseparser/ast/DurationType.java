package com.pulseparser.ast;

public record DurationType(
    Span span
) implements TypeNode {
    public DurationType() {
        this(null);
    }

    @Override
    public String kind() {
        return "DurationType";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
