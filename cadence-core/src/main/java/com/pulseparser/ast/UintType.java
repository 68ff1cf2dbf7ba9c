package com.pulseparser.ast;

public record UintType(
    Span span,
    Expression size
) implements TypeNode {
    public UintType() {
        this(null, null);
    }

    public UintType(Expression size) {
        this(null, size);
    }

    @Override
    public String kind() {
        return "UintType";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
