package com.pulseparser.ast;

public record Include(
    Span span,
    String filename
) implements Statement {
    public Include(String filename) {
        this(null, filename);
    }

    @Override
    public String kind() {
        return "Include";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
