package com.pulseparser.ast;

public record ClassicalArgument(
    Span span,
    TypeNode type,
    Identifier name
) implements Node {
    public ClassicalArgument(TypeNode type, Identifier name) {
        this(null, type, name);
    }

    @Override
    public String kind() {
        return "ClassicalArgument";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
