package com.pulseparser.ast;

/**
 * The set a {@link ForInLoop} iterates over: a bracketed range, a braced discrete set,
 * or any other expression.
 */
public sealed interface SetDeclaration extends Node permits
    RangeDefinition,
    DiscreteSet,
    Expression {
}
