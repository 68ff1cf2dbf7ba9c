package com.pulseparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.pulseparser.ast.*;

/**
 * Polymorphic type handling for the node hierarchy. Every node is written with a
 * {@code "kind"} property naming its variant, matching {@link Node#kind()}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Program.class, name = "Program"),

    // Statements
    @JsonSubTypes.Type(value = CalibrationStatement.class, name = "CalibrationStatement"),
    @JsonSubTypes.Type(value = CalibrationDefinition.class, name = "CalibrationDefinition"),
    @JsonSubTypes.Type(value = CalibrationGrammarDeclaration.class, name = "CalibrationGrammarDeclaration"),
    @JsonSubTypes.Type(value = ExternDeclaration.class, name = "ExternDeclaration"),
    @JsonSubTypes.Type(value = ClassicalDeclaration.class, name = "ClassicalDeclaration"),
    @JsonSubTypes.Type(value = ClassicalAssignment.class, name = "ClassicalAssignment"),
    @JsonSubTypes.Type(value = ForInLoop.class, name = "ForInLoop"),
    @JsonSubTypes.Type(value = QuantumBarrier.class, name = "QuantumBarrier"),
    @JsonSubTypes.Type(value = QuantumDelay.class, name = "QuantumDelay"),
    @JsonSubTypes.Type(value = ExpressionStatement.class, name = "ExpressionStatement"),
    @JsonSubTypes.Type(value = ReturnStatement.class, name = "ReturnStatement"),
    @JsonSubTypes.Type(value = Include.class, name = "Include"),

    // Arguments and sets
    @JsonSubTypes.Type(value = ClassicalArgument.class, name = "ClassicalArgument"),
    @JsonSubTypes.Type(value = ExternArgument.class, name = "ExternArgument"),
    @JsonSubTypes.Type(value = RangeDefinition.class, name = "RangeDefinition"),
    @JsonSubTypes.Type(value = DiscreteSet.class, name = "DiscreteSet"),

    // Expressions
    @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
    @JsonSubTypes.Type(value = IntegerLiteral.class, name = "IntegerLiteral"),
    @JsonSubTypes.Type(value = FloatLiteral.class, name = "FloatLiteral"),
    @JsonSubTypes.Type(value = ImaginaryLiteral.class, name = "ImaginaryLiteral"),
    @JsonSubTypes.Type(value = BooleanLiteral.class, name = "BooleanLiteral"),
    @JsonSubTypes.Type(value = DurationLiteral.class, name = "DurationLiteral"),
    @JsonSubTypes.Type(value = FunctionCall.class, name = "FunctionCall"),
    @JsonSubTypes.Type(value = UnaryExpression.class, name = "UnaryExpression"),
    @JsonSubTypes.Type(value = BinaryExpression.class, name = "BinaryExpression"),

    // Types
    @JsonSubTypes.Type(value = IntType.class, name = "IntType"),
    @JsonSubTypes.Type(value = UintType.class, name = "UintType"),
    @JsonSubTypes.Type(value = FloatType.class, name = "FloatType"),
    @JsonSubTypes.Type(value = AngleType.class, name = "AngleType"),
    @JsonSubTypes.Type(value = BitType.class, name = "BitType"),
    @JsonSubTypes.Type(value = BoolType.class, name = "BoolType"),
    @JsonSubTypes.Type(value = ComplexType.class, name = "ComplexType"),
    @JsonSubTypes.Type(value = DurationType.class, name = "DurationType"),
    @JsonSubTypes.Type(value = PortType.class, name = "PortType"),
    @JsonSubTypes.Type(value = FrameType.class, name = "FrameType"),
    @JsonSubTypes.Type(value = WaveformType.class, name = "WaveformType")
})
public interface NodeMixin {
}
