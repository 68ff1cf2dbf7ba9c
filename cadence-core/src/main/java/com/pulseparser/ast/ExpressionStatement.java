package com.pulseparser.ast;

public record ExpressionStatement(
    Span span,
    Expression expression
) implements Statement {
    public ExpressionStatement(Expression expression) {
        this(null, expression);
    }

    @Override
    public String kind() {
        return "ExpressionStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
