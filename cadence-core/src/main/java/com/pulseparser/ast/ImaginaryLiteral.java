package com.pulseparser.ast;

public record ImaginaryLiteral(
    Span span,
    double value
) implements Expression {
    public ImaginaryLiteral(double value) {
        this(null, value);
    }

    @Override
    public String kind() {
        return "ImaginaryLiteral";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
