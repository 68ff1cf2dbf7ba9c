package com.pulseparser.ast;

public record FloatType(
    Span span,
    Expression size
) implements TypeNode {
    public FloatType() {
        this(null, null);
    }

    public FloatType(Expression size) {
        this(null, size);
    }

    @Override
    public String kind() {
        return "FloatType";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
