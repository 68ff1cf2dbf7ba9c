package com.pulseparser.ast;

import java.util.List;

/**
 * Signature of a routine implemented outside the program:
 * {@code extern name(type, ...) -> type;}. Arguments carry types only.
 */
public record ExternDeclaration(
    Span span,
    Identifier name,
    List<ExternArgument> arguments,
    TypeNode returnType
) implements Statement {
    public ExternDeclaration {
        arguments = List.copyOf(arguments);
    }

    public ExternDeclaration(Identifier name, List<ExternArgument> arguments, TypeNode returnType) {
        this(null, name, arguments, returnType);
    }

    @Override
    public String kind() {
        return "ExternDeclaration";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
