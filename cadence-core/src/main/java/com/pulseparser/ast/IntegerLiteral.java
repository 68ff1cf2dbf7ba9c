package com.pulseparser.ast;

/**
 * Integer literal in decimal, hex, octal or binary notation. The value is never
 * negative: a leading minus parses as a {@link UnaryExpression}.
 */
public record IntegerLiteral(
    Span span,
    long value
) implements Expression {
    public IntegerLiteral(long value) {
        this(null, value);
    }

    @Override
    public String kind() {
        return "IntegerLiteral";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
