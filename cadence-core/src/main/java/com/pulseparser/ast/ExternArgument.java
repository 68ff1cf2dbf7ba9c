package com.pulseparser.ast;

public record ExternArgument(
    Span span,
    TypeNode type
) implements Node {
    public ExternArgument(TypeNode type) {
        this(null, type);
    }

    @Override
    public String kind() {
        return "ExternArgument";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
