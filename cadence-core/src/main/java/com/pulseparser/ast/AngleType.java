package com.pulseparser.ast;

public record AngleType(
    Span span,
    Expression size
) implements TypeNode {
    public AngleType() {
        this(null, null);
    }

    public AngleType(Expression size) {
        this(null, size);
    }

    @Override
    public String kind() {
        return "AngleType";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
