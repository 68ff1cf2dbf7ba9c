package com.pulseparser.ast;

public record DurationLiteral(
    Span span,
    double value,
    TimeUnit unit
) implements Expression {
    public DurationLiteral(double value, TimeUnit unit) {
        this(null, value, unit);
    }

    @Override
    public String kind() {
        return "DurationLiteral";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
