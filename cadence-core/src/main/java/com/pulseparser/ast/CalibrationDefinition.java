package com.pulseparser.ast;

import java.util.List;

/**
 * A named pulse routine bound to physical qubits:
 * {@code defcal name(type arg, ...) $0, q [-> type] { ... }}.
 * {@code returnType} is {@code null} when the definition has no return clause.
 */
public record CalibrationDefinition(
    Span span,
    Identifier name,
    List<ClassicalArgument> arguments,
    List<Identifier> qubits,
    TypeNode returnType,
    List<Statement> body
) implements Statement {
    public CalibrationDefinition {
        arguments = List.copyOf(arguments);
        qubits = List.copyOf(qubits);
        body = List.copyOf(body);
    }

    public CalibrationDefinition(Identifier name, List<ClassicalArgument> arguments, List<Identifier> qubits, TypeNode returnType, List<Statement> body) {
        this(null, name, arguments, qubits, returnType, body);
    }

    @Override
    public String kind() {
        return "CalibrationDefinition";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
