package com.pulseparser.ast;

import java.util.List;

public record FunctionCall(
    Span span,
    Identifier name,
    List<Expression> arguments
) implements Expression {
    public FunctionCall {
        arguments = List.copyOf(arguments);
    }

    public FunctionCall(Identifier name, List<Expression> arguments) {
        this(null, name, arguments);
    }

    @Override
    public String kind() {
        return "FunctionCall";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
