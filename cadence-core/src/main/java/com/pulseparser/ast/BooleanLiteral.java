package com.pulseparser.ast;

public record BooleanLiteral(
    Span span,
    boolean value
) implements Expression {
    public BooleanLiteral(boolean value) {
        this(null, value);
    }

    @Override
    public String kind() {
        return "BooleanLiteral";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
