package com.pulseparser.ast;

public record ReturnStatement(
    Span span,
    Expression expression
) implements Statement {
    public ReturnStatement(Expression expression) {
        this(null, expression);
    }

    @Override
    public String kind() {
        return "ReturnStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
