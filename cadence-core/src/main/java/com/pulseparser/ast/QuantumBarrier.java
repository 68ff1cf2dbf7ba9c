package com.pulseparser.ast;

import java.util.List;

/**
 * Synchronization point for qubits or frames. An empty list is a global barrier.
 */
public record QuantumBarrier(
    Span span,
    List<Identifier> qubits
) implements Statement {
    public QuantumBarrier {
        qubits = List.copyOf(qubits);
    }

    public QuantumBarrier(List<Identifier> qubits) {
        this(null, qubits);
    }

    @Override
    public String kind() {
        return "QuantumBarrier";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
