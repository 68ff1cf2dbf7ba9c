package com.pulseparser.ast;

/**
 * A name reference. Hardware qubits such as {@code $0} are identifiers whose name
 * keeps the leading dollar sign.
 */
public record Identifier(
    Span span,
    String name
) implements Expression {
    public Identifier(String name) {
        this(null, name);
    }

    @Override
    public String kind() {
        return "Identifier";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
