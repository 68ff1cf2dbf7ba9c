package com.pulseparser.ast;

public record ClassicalDeclaration(
    Span span,
    TypeNode type,
    Identifier identifier,
    Expression initExpression
) implements Statement {
    public ClassicalDeclaration(TypeNode type, Identifier identifier, Expression initExpression) {
        this(null, type, identifier, initExpression);
    }

    @Override
    public String kind() {
        return "ClassicalDeclaration";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
