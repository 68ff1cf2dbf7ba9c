package com.pulseparser.ast;

public record ComplexType(
    Span span,
    TypeNode baseType
) implements TypeNode {
    public ComplexType() {
        this(null, null);
    }

    public ComplexType(TypeNode baseType) {
        this(null, baseType);
    }

    @Override
    public String kind() {
        return "ComplexType";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
