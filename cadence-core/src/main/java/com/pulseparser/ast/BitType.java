package com.pulseparser.ast;

public record BitType(
    Span span,
    Expression size
) implements TypeNode {
    public BitType() {
        this(null, null);
    }

    public BitType(Expression size) {
        this(null, size);
    }

    @Override
    public String kind() {
        return "BitType";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
