package com.pulseparser.ast;

public sealed interface Statement extends Node permits
    CalibrationStatement,
    CalibrationDefinition,
    CalibrationGrammarDeclaration,
    ExternDeclaration,
    ClassicalDeclaration,
    ClassicalAssignment,
    ForInLoop,
    QuantumBarrier,
    QuantumDelay,
    ExpressionStatement,
    ReturnStatement,
    Include {
}
