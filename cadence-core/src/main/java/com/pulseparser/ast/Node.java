package com.pulseparser.ast;

/**
 * Base interface for all calibration AST nodes.
 *
 * <p>Every node produced by the parser carries the {@link Span} of the source text it
 * was built from. Nodes created through the span-less convenience constructors carry
 * {@code null}; those are meant for building expected trees in tests and for
 * span-stripped copies.</p>
 */
public sealed interface Node permits
    Program,
    Statement,
    SetDeclaration,
    TypeNode,
    ClassicalArgument,
    ExternArgument {

    Span span();

    String kind();

    <R> R accept(NodeVisitor<R> visitor);
}
