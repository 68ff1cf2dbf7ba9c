package com.pulseparser.ast;

import java.util.List;

// for <type> <identifier> in <set> <block>
public record ForInLoop(
    Span span,
    TypeNode type,
    Identifier identifier,
    SetDeclaration setDeclaration,
    List<Statement> block
) implements Statement {
    public ForInLoop {
        block = List.copyOf(block);
    }

    public ForInLoop(TypeNode type, Identifier identifier, SetDeclaration setDeclaration, List<Statement> block) {
        this(null, type, identifier, setDeclaration, block);
    }

    @Override
    public String kind() {
        return "ForInLoop";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
