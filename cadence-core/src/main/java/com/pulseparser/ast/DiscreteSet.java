package com.pulseparser.ast;

import java.util.List;

public record DiscreteSet(
    Span span,
    List<Expression> values
) implements SetDeclaration {
    public DiscreteSet {
        values = List.copyOf(values);
    }

    public DiscreteSet(List<Expression> values) {
        this(null, values);
    }

    @Override
    public String kind() {
        return "DiscreteSet";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
