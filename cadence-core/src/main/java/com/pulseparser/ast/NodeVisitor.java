package com.pulseparser.ast;

/**
 * Visitor over the closed set of node variants.
 *
 * <p>There is one {@code visit} method per concrete record implementing {@link Node},
 * and each record's {@code accept} calls the overload for its own type. Adding a node
 * variant therefore fails to compile until every visitor handles it.</p>
 *
 * @param <R> result type of the visit
 */
public interface NodeVisitor<R> {
    R visit(Program node);

    // Statements
    R visit(CalibrationStatement node);
    R visit(CalibrationDefinition node);
    R visit(CalibrationGrammarDeclaration node);
    R visit(ExternDeclaration node);
    R visit(ClassicalDeclaration node);
    R visit(ClassicalAssignment node);
    R visit(ForInLoop node);
    R visit(QuantumBarrier node);
    R visit(QuantumDelay node);
    R visit(ExpressionStatement node);
    R visit(ReturnStatement node);
    R visit(Include node);

    // Arguments and sets
    R visit(ClassicalArgument node);
    R visit(ExternArgument node);
    R visit(RangeDefinition node);
    R visit(DiscreteSet node);

    // Expressions
    R visit(Identifier node);
    R visit(IntegerLiteral node);
    R visit(FloatLiteral node);
    R visit(ImaginaryLiteral node);
    R visit(BooleanLiteral node);
    R visit(DurationLiteral node);
    R visit(FunctionCall node);
    R visit(UnaryExpression node);
    R visit(BinaryExpression node);

    // Types
    R visit(IntType node);
    R visit(UintType node);
    R visit(FloatType node);
    R visit(AngleType node);
    R visit(BitType node);
    R visit(BoolType node);
    R visit(ComplexType node);
    R visit(DurationType node);
    R visit(PortType node);
    R visit(FrameType node);
    R visit(WaveformType node);
}
