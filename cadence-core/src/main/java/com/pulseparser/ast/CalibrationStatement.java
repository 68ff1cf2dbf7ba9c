package com.pulseparser.ast;

import java.util.List;

/**
 * An inline pulse-control scope: {@code cal { ... }}.
 */
public record CalibrationStatement(
    Span span,
    List<Statement> body
) implements Statement {
    public CalibrationStatement {
        body = List.copyOf(body);
    }

    public CalibrationStatement(List<Statement> body) {
        this(null, body);
    }

    @Override
    public String kind() {
        return "CalibrationStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
