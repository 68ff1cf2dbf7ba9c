package com.pulseparser.ast;

public record BinaryExpression(
    Span span,
    BinaryOperator op,
    Expression lhs,
    Expression rhs
) implements Expression {
    public BinaryExpression(BinaryOperator op, Expression lhs, Expression rhs) {
        this(null, op, lhs, rhs);
    }

    @Override
    public String kind() {
        return "BinaryExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
