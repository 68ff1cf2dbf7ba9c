package com.pulseparser.ast;

public record PortType(
    Span span
) implements TypeNode {
    public PortType() {
        this(null);
    }

    @Override
    public String kind() {
        return "PortType";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
