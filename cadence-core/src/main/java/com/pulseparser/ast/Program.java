package com.pulseparser.ast;

import java.util.List;

/**
 * Root of a parsed source file. {@code version} is the number from an
 * {@code OPENQASM x.y;} header, or {@code null} when the header is absent.
 */
public record Program(
    Span span,
    String version,
    List<Statement> statements
) implements Node {
    public Program {
        statements = List.copyOf(statements);
    }

    public Program(String version, List<Statement> statements) {
        this(null, version, statements);
    }

    @Override
    public String kind() {
        return "Program";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
