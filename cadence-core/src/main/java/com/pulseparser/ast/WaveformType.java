package com.pulseparser.ast;

public record WaveformType(
    Span span
) implements TypeNode {
    public WaveformType() {
        this(null);
    }

    @Override
    public String kind() {
        return "WaveformType";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
