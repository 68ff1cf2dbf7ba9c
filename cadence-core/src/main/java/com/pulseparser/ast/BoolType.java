package com.pulseparser.ast;

public record BoolType(
    Span span
) implements TypeNode {
    public BoolType() {
        this(null);
    }

    @Override
    public String kind() {
        return "BoolType";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
