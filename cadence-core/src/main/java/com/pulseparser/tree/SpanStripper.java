package com.pulseparser.tree;

import com.pulseparser.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Deep copy of a tree with every span removed. Two parses of sources that differ only
 * in whitespace or comments strip to equal trees, which makes this the basis for
 * structural comparison.
 */
public final class SpanStripper implements NodeVisitor<Node> {
    private static final SpanStripper INSTANCE = new SpanStripper();

    private SpanStripper() {
    }

    @SuppressWarnings("unchecked")
    public static <T extends Node> T strip(T node) {
        return node == null ? null : (T) node.accept(INSTANCE);
    }

    /**
     * Compares two trees by kind, fields and children, ignoring spans.
     */
    public static boolean structurallyEqual(Node a, Node b) {
        return Objects.equals(strip(a), strip(b));
    }

    private static <T extends Node> List<T> stripAll(List<T> nodes) {
        List<T> stripped = new ArrayList<>(nodes.size());
        for (T node : nodes) {
            stripped.add(strip(node));
        }
        return stripped;
    }

    @Override
    public Node visit(Program node) {
        return new Program(null, node.version(), stripAll(node.statements()));
    }

    @Override
    public Node visit(CalibrationStatement node) {
        return new CalibrationStatement(null, stripAll(node.body()));
    }

    @Override
    public Node visit(CalibrationDefinition node) {
        return new CalibrationDefinition(null, strip(node.name()), stripAll(node.arguments()),
            stripAll(node.qubits()), strip(node.returnType()), stripAll(node.body()));
    }

    @Override
    public Node visit(CalibrationGrammarDeclaration node) {
        return new CalibrationGrammarDeclaration(null, node.name());
    }

    @Override
    public Node visit(ExternDeclaration node) {
        return new ExternDeclaration(null, strip(node.name()), stripAll(node.arguments()), strip(node.returnType()));
    }

    @Override
    public Node visit(ClassicalDeclaration node) {
        return new ClassicalDeclaration(null, strip(node.type()), strip(node.identifier()), strip(node.initExpression()));
    }

    @Override
    public Node visit(ClassicalAssignment node) {
        return new ClassicalAssignment(null, strip(node.lvalue()), node.op(), strip(node.rvalue()));
    }

    @Override
    public Node visit(ForInLoop node) {
        return new ForInLoop(null, strip(node.type()), strip(node.identifier()),
            strip(node.setDeclaration()), stripAll(node.block()));
    }

    @Override
    public Node visit(QuantumBarrier node) {
        return new QuantumBarrier(null, stripAll(node.qubits()));
    }

    @Override
    public Node visit(QuantumDelay node) {
        return new QuantumDelay(null, strip(node.duration()), stripAll(node.qubits()));
    }

    @Override
    public Node visit(ExpressionStatement node) {
        return new ExpressionStatement(null, strip(node.expression()));
    }

    @Override
    public Node visit(ReturnStatement node) {
        return new ReturnStatement(null, strip(node.expression()));
    }

    @Override
    public Node visit(Include node) {
        return new Include(null, node.filename());
    }

    @Override
    public Node visit(ClassicalArgument node) {
        return new ClassicalArgument(null, strip(node.type()), strip(node.name()));
    }

    @Override
    public Node visit(ExternArgument node) {
        return new ExternArgument(null, strip(node.type()));
    }

    @Override
    public Node visit(RangeDefinition node) {
        return new RangeDefinition(null, strip(node.start()), strip(node.end()), strip(node.step()));
    }

    @Override
    public Node visit(DiscreteSet node) {
        return new DiscreteSet(null, stripAll(node.values()));
    }

    @Override
    public Node visit(Identifier node) {
        return new Identifier(null, node.name());
    }

    @Override
    public Node visit(IntegerLiteral node) {
        return new IntegerLiteral(null, node.value());
    }

    @Override
    public Node visit(FloatLiteral node) {
        return new FloatLiteral(null, node.value());
    }

    @Override
    public Node visit(ImaginaryLiteral node) {
        return new ImaginaryLiteral(null, node.value());
    }

    @Override
    public Node visit(BooleanLiteral node) {
        return new BooleanLiteral(null, node.value());
    }

    @Override
    public Node visit(DurationLiteral node) {
        return new DurationLiteral(null, node.value(), node.unit());
    }

    @Override
    public Node visit(FunctionCall node) {
        return new FunctionCall(null, strip(node.name()), stripAll(node.arguments()));
    }

    @Override
    public Node visit(UnaryExpression node) {
        return new UnaryExpression(null, node.op(), strip(node.expression()));
    }

    @Override
    public Node visit(BinaryExpression node) {
        return new BinaryExpression(null, node.op(), strip(node.lhs()), strip(node.rhs()));
    }

    @Override
    public Node visit(IntType node) {
        return new IntType(null, strip(node.size()));
    }

    @Override
    public Node visit(UintType node) {
        return new UintType(null, strip(node.size()));
    }

    @Override
    public Node visit(FloatType node) {
        return new FloatType(null, strip(node.size()));
    }

    @Override
    public Node visit(AngleType node) {
        return new AngleType(null, strip(node.size()));
    }

    @Override
    public Node visit(BitType node) {
        return new BitType(null, strip(node.size()));
    }

    @Override
    public Node visit(BoolType node) {
        return new BoolType(null);
    }

    @Override
    public Node visit(ComplexType node) {
        return new ComplexType(null, strip(node.baseType()));
    }

    @Override
    public Node visit(DurationType node) {
        return new DurationType(null);
    }

    @Override
    public Node visit(PortType node) {
        return new PortType(null);
    }

    @Override
    public Node visit(FrameType node) {
        return new FrameType(null);
    }

    @Override
    public Node visit(WaveformType node) {
        return new WaveformType(null);
    }
}
