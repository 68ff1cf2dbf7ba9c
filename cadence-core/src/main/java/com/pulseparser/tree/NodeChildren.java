package com.pulseparser.tree;

import com.pulseparser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the structural children of a node in field declaration order, list fields
 * element by element. Absent optional fields are skipped.
 */
public final class NodeChildren implements NodeVisitor<List<Node>> {
    private static final NodeChildren INSTANCE = new NodeChildren();

    private NodeChildren() {
    }

    public static List<Node> of(Node node) {
        return node.accept(INSTANCE);
    }

    private static List<Node> children(Object... fields) {
        List<Node> children = new ArrayList<>();
        for (Object field : fields) {
            if (field instanceof Node node) {
                children.add(node);
            } else if (field instanceof List<?> list) {
                for (Object element : list) {
                    children.add((Node) element);
                }
            }
        }
        return children;
    }

    @Override
    public List<Node> visit(Program node) {
        return children(node.statements());
    }

    @Override
    public List<Node> visit(CalibrationStatement node) {
        return children(node.body());
    }

    @Override
    public List<Node> visit(CalibrationDefinition node) {
        return children(node.name(), node.arguments(), node.qubits(), node.returnType(), node.body());
    }

    @Override
    public List<Node> visit(CalibrationGrammarDeclaration node) {
        return List.of();
    }

    @Override
    public List<Node> visit(ExternDeclaration node) {
        return children(node.name(), node.arguments(), node.returnType());
    }

    @Override
    public List<Node> visit(ClassicalDeclaration node) {
        return children(node.type(), node.identifier(), node.initExpression());
    }

    @Override
    public List<Node> visit(ClassicalAssignment node) {
        return children(node.lvalue(), node.rvalue());
    }

    @Override
    public List<Node> visit(ForInLoop node) {
        return children(node.type(), node.identifier(), node.setDeclaration(), node.block());
    }

    @Override
    public List<Node> visit(QuantumBarrier node) {
        return children(node.qubits());
    }

    @Override
    public List<Node> visit(QuantumDelay node) {
        return children(node.duration(), node.qubits());
    }

    @Override
    public List<Node> visit(ExpressionStatement node) {
        return children(node.expression());
    }

    @Override
    public List<Node> visit(ReturnStatement node) {
        return children(node.expression());
    }

    @Override
    public List<Node> visit(Include node) {
        return List.of();
    }

    @Override
    public List<Node> visit(ClassicalArgument node) {
        return children(node.type(), node.name());
    }

    @Override
    public List<Node> visit(ExternArgument node) {
        return children(node.type());
    }

    @Override
    public List<Node> visit(RangeDefinition node) {
        return children(node.start(), node.end(), node.step());
    }

    @Override
    public List<Node> visit(DiscreteSet node) {
        return children(node.values());
    }

    @Override
    public List<Node> visit(Identifier node) {
        return List.of();
    }

    @Override
    public List<Node> visit(IntegerLiteral node) {
        return List.of();
    }

    @Override
    public List<Node> visit(FloatLiteral node) {
        return List.of();
    }

    @Override
    public List<Node> visit(ImaginaryLiteral node) {
        return List.of();
    }

    @Override
    public List<Node> visit(BooleanLiteral node) {
        return List.of();
    }

    @Override
    public List<Node> visit(DurationLiteral node) {
        return List.of();
    }

    @Override
    public List<Node> visit(FunctionCall node) {
        return children(node.name(), node.arguments());
    }

    @Override
    public List<Node> visit(UnaryExpression node) {
        return children(node.expression());
    }

    @Override
    public List<Node> visit(BinaryExpression node) {
        return children(node.lhs(), node.rhs());
    }

    @Override
    public List<Node> visit(IntType node) {
        return children(node.size());
    }

    @Override
    public List<Node> visit(UintType node) {
        return children(node.size());
    }

    @Override
    public List<Node> visit(FloatType node) {
        return children(node.size());
    }

    @Override
    public List<Node> visit(AngleType node) {
        return children(node.size());
    }

    @Override
    public List<Node> visit(BitType node) {
        return children(node.size());
    }

    @Override
    public List<Node> visit(BoolType node) {
        return List.of();
    }

    @Override
    public List<Node> visit(ComplexType node) {
        return children(node.baseType());
    }

    @Override
    public List<Node> visit(DurationType node) {
        return List.of();
    }

    @Override
    public List<Node> visit(PortType node) {
        return List.of();
    }

    @Override
    public List<Node> visit(FrameType node) {
        return List.of();
    }

    @Override
    public List<Node> visit(WaveformType node) {
        return List.of();
    }
}
