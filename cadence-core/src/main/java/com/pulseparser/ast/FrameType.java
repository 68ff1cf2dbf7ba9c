package com.pulseparser.ast;

public record FrameType(
    Span span
) implements TypeNode {
    public FrameType() {
        this(null);
    }

    @Override
    public String kind() {
        return "FrameType";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
