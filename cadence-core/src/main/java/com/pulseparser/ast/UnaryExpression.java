package com.pulseparser.ast;

public record UnaryExpression(
    Span span,
    UnaryOperator op,
    Expression expression
) implements Expression {
    public UnaryExpression(UnaryOperator op, Expression expression) {
        this(null, op, expression);
    }

    @Override
    public String kind() {
        return "UnaryExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
