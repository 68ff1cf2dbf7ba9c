package com.pulseparser.ast;

public record ClassicalAssignment(
    Span span,
    Identifier lvalue,
    AssignmentOperator op,
    Expression rvalue
) implements Statement {
    public ClassicalAssignment(Identifier lvalue, AssignmentOperator op, Expression rvalue) {
        this(null, lvalue, op, rvalue);
    }

    @Override
    public String kind() {
        return "ClassicalAssignment";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
