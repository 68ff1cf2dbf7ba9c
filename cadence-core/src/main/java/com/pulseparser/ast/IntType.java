package com.pulseparser.ast;

public record IntType(
    Span span,
    Expression size
) implements TypeNode {
    public IntType() {
        this(null, null);
    }

    public IntType(Expression size) {
        this(null, size);
    }

    @Override
    public String kind() {
        return "IntType";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
