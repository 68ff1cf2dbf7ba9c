package com.pulseparser.ast;

public record FloatLiteral(
    Span span,
    double value
) implements Expression {
    public FloatLiteral(double value) {
        this(null, value);
    }

    @Override
    public String kind() {
        return "FloatLiteral";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
