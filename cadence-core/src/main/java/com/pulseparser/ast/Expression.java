package com.pulseparser.ast;

public sealed interface Expression extends SetDeclaration permits
    Identifier,
    IntegerLiteral,
    FloatLiteral,
    ImaginaryLiteral,
    BooleanLiteral,
    DurationLiteral,
    FunctionCall,
    UnaryExpression,
    BinaryExpression {
}
