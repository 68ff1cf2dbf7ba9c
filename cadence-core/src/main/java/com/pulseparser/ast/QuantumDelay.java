package com.pulseparser.ast;

import java.util.List;

/**
 * {@code delay[duration] a, b;} idles the listed qubits or frames. An empty list
 * delays every target.
 */
public record QuantumDelay(
    Span span,
    Expression duration,
    List<Identifier> qubits
) implements Statement {
    public QuantumDelay {
        qubits = List.copyOf(qubits);
    }

    public QuantumDelay(Expression duration, List<Identifier> qubits) {
        this(null, duration, qubits);
    }

    @Override
    public String kind() {
        return "QuantumDelay";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
