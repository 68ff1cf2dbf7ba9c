package com.pulseparser;

import com.pulseparser.ast.*;
import com.pulseparser.tree.SpanGuard;
import com.pulseparser.tree.SpanStripper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CalibrationParserTest {

    private static Program parseStripped(String source) {
        Program program = Parser.parse(source);
        SpanGuard.check(program);
        return SpanStripper.strip(program);
    }

    @Test
    @DisplayName("defcal with a typed argument, a hardware qubit and a return statement")
    void calibrationDefinition() {
        String source = "defcal rz(angle[20] theta) $1 { return shift_phase(drive($1), -theta); }";

        Program expected = new Program(null, List.of(
            new CalibrationDefinition(
                new Identifier("rz"),
                List.of(new ClassicalArgument(new AngleType(new IntegerLiteral(20)), new Identifier("theta"))),
                List.of(new Identifier("$1")),
                null,
                List.of(new ReturnStatement(
                    new FunctionCall(new Identifier("shift_phase"), List.of(
                        new FunctionCall(new Identifier("drive"), List.of(new Identifier("$1"))),
                        new UnaryExpression(UnaryOperator.NEGATE, new Identifier("theta"))))))
            )
        ));

        assertEquals(expected, parseStripped(source));
    }

    @Test
    @DisplayName("cal block with extern, port and frame declarations")
    void calibrationBlock() {
        String source = String.join("\n",
            "cal {",
            "    extern drag(complex[float[size]], duration, duration, float[size]) -> waveform;",
            "",
            "    port q0;",
            "",
            "    frame q0_frame = newframe(q0, 0);",
            "}");

        Program expected = new Program(null, List.of(
            new CalibrationStatement(List.of(
                new ExternDeclaration(
                    new Identifier("drag"),
                    List.of(
                        new ExternArgument(new ComplexType(new FloatType(new Identifier("size")))),
                        new ExternArgument(new DurationType()),
                        new ExternArgument(new DurationType()),
                        new ExternArgument(new FloatType(new Identifier("size")))),
                    new WaveformType()),
                new ClassicalDeclaration(new PortType(), new Identifier("q0"), null),
                new ClassicalDeclaration(new FrameType(), new Identifier("q0_frame"),
                    new FunctionCall(new Identifier("newframe"),
                        List.of(new Identifier("q0"), new IntegerLiteral(0))))
            ))
        ));

        assertEquals(expected, parseStripped(source));
    }

    @Test
    @DisplayName("cal block with waveform declaration and a for loop over a range")
    void calibrationBlockWithLoop() {
        String source = String.join("\n",
            "cal {",
            "    port tx_port;",
            "    frame tx_frame = newframe(tx_port, 7883050000.0, 0);",
            "    waveform readout_waveform_wf = constant(5e-06, 0.03);",
            "    for int shot in [0:499] {",
            "        play(readout_waveform_wf, tx_frame);",
            "        barrier tx_frame;",
            "    }",
            "}");

        Program expected = new Program(null, List.of(
            new CalibrationStatement(List.of(
                new ClassicalDeclaration(new PortType(), new Identifier("tx_port"), null),
                new ClassicalDeclaration(new FrameType(), new Identifier("tx_frame"),
                    new FunctionCall(new Identifier("newframe"), List.of(
                        new Identifier("tx_port"), new FloatLiteral(7883050000.0), new IntegerLiteral(0)))),
                new ClassicalDeclaration(new WaveformType(), new Identifier("readout_waveform_wf"),
                    new FunctionCall(new Identifier("constant"), List.of(
                        new FloatLiteral(5e-06), new FloatLiteral(0.03)))),
                new ForInLoop(
                    new IntType(),
                    new Identifier("shot"),
                    new RangeDefinition(new IntegerLiteral(0), new IntegerLiteral(499), null),
                    List.of(
                        new ExpressionStatement(new FunctionCall(new Identifier("play"), List.of(
                            new Identifier("readout_waveform_wf"), new Identifier("tx_frame")))),
                        new QuantumBarrier(List.of(new Identifier("tx_frame")))))
            ))
        ));

        assertEquals(expected, parseStripped(source));
    }

    @Test
    @DisplayName("Rabi experiment with nested loops, delays and barriers")
    void rabiExperiment() {
        String source = String.join("\n",
            "cal {",
            "    port xy_port;",
            "    port tx_port;",
            "    port rx_port;",
            "    frame xy_frame = newframe(xy_port, 3714500000.0, 0);",
            "    frame tx_frame = newframe(tx_port, 7883050000.0, 0);",
            "    frame rx_frame = newframe(rx_port, 7883050000.0, 0);",
            "    waveform rabi_pulse_wf = gaussian(1e-07, 2.5e-08, 1.0, 0.0);",
            "    waveform readout_waveform_wf = constant(5e-06, 0.03);",
            "    waveform readout_kernel_wf = constant(5e-06, 1.0);",
            "    for int shot in [0:499] {",
            "        set_scale(0.0, xy_frame);",
            "        for int amp in [0:50] {",
            "            set_frequency(3714500000.0, xy_frame);",
            "            delay[200000.0ns] xy_frame, tx_frame, rx_frame;",
            "            set_phase(0, xy_frame);",
            "            play(rabi_pulse_wf, xy_frame);",
            "            barrier xy_frame, tx_frame, rx_frame;",
            "            set_phase(0, tx_frame);",
            "            set_phase(0, rx_frame);",
            "            play(readout_waveform_wf, tx_frame);",
            "            capture(readout_kernel_wf, rx_frame);",
            "            barrier xy_frame, tx_frame, rx_frame;",
            "            shift_scale(0.018000000000000002, xy_frame);",
            "        }",
            "    }",
            "}");

        Program program = assertDoesNotThrow(() -> Parser.parse(source));
        assertDoesNotThrow(() -> SpanGuard.check(program));

        CalibrationStatement cal = (CalibrationStatement) program.statements().get(0);
        assertEquals(10, cal.body().size());

        ForInLoop outer = (ForInLoop) cal.body().get(9);
        ForInLoop inner = (ForInLoop) outer.block().get(1);
        assertEquals(11, inner.block().size());

        QuantumDelay delay = (QuantumDelay) SpanStripper.strip(inner.block().get(1));
        assertEquals(new QuantumDelay(new DurationLiteral(200000.0, TimeUnit.NS),
            List.of(new Identifier("xy_frame"), new Identifier("tx_frame"), new Identifier("rx_frame"))), delay);
    }

    @Test
    void programHeaderAndIncludes() {
        Program program = parseStripped(String.join("\n",
            "OPENQASM 3.0;",
            "defcalgrammar \"openpulse\";",
            "include \"stdgates.inc\";"));

        assertEquals("3.0", program.version());
        assertEquals(List.of(
            new CalibrationGrammarDeclaration("openpulse"),
            new Include("stdgates.inc")), program.statements());
    }

    @Test
    void argumentsAndQubitsKeepSourceOrder() {
        Program program = parseStripped(
            "defcal cx(float[64] a, int b, duration c) $0, $1, q2 -> bit { return 1; }");

        CalibrationDefinition defcal = (CalibrationDefinition) program.statements().get(0);
        assertEquals(List.of("a", "b", "c"),
            defcal.arguments().stream().map(arg -> arg.name().name()).toList());
        assertEquals(List.of("$0", "$1", "q2"),
            defcal.qubits().stream().map(Identifier::name).toList());
        assertEquals(new BitType(), defcal.returnType());
    }

    @Test
    void defcalWithoutArgumentList() {
        Program program = parseStripped("defcal measure $0 -> bit { return capture(kernel, rx_frame); }");

        CalibrationDefinition defcal = (CalibrationDefinition) program.statements().get(0);
        assertTrue(defcal.arguments().isEmpty());
        assertEquals(List.of(new Identifier("$0")), defcal.qubits());
    }

    @Test
    void nestedCalibrationBlocks() {
        Program program = parseStripped("cal { cal { port p; } barrier; }");

        assertEquals(new Program(null, List.of(
            new CalibrationStatement(List.of(
                new CalibrationStatement(List.of(
                    new ClassicalDeclaration(new PortType(), new Identifier("p"), null))),
                new QuantumBarrier(List.of()))))), program);
    }

    @Test
    void forLoopOverSteppedRangeAndDiscreteSet() {
        Program program = parseStripped(String.join("\n",
            "for int i in [0:10:2] play(wf, fr);",
            "for float f in {1.0, 2.5} { set_frequency(f, fr); }"));

        ForInLoop stepped = (ForInLoop) program.statements().get(0);
        assertEquals(new RangeDefinition(new IntegerLiteral(0), new IntegerLiteral(10), new IntegerLiteral(2)),
            stepped.setDeclaration());
        assertEquals(1, stepped.block().size());

        ForInLoop discrete = (ForInLoop) program.statements().get(1);
        assertEquals(new DiscreteSet(List.of(new FloatLiteral(1.0), new FloatLiteral(2.5))),
            discrete.setDeclaration());
    }

    @Test
    void assignmentsAndExternWithoutReturnType() {
        Program program = parseStripped(String.join("\n",
            "extern reset_phase(frame);",
            "cal { duration d = 100dt; d += 4ns; }"));

        assertEquals(new ExternDeclaration(new Identifier("reset_phase"),
            List.of(new ExternArgument(new FrameType())), null), program.statements().get(0));

        CalibrationStatement cal = (CalibrationStatement) program.statements().get(1);
        assertEquals(new ClassicalAssignment(new Identifier("d"), AssignmentOperator.PLUS_ASSIGN,
            new DurationLiteral(4, TimeUnit.NS)), cal.body().get(1));
    }

    @Test
    void delayWithoutTargetsAppliesToAll() {
        Program program = parseStripped("cal { delay[4dt]; delay[dur] $0, tx_frame; }");

        CalibrationStatement cal = (CalibrationStatement) program.statements().get(0);
        assertEquals(List.of(
            new QuantumDelay(new DurationLiteral(4, TimeUnit.DT), List.of()),
            new QuantumDelay(new Identifier("dur"), List.of(new Identifier("$0"), new Identifier("tx_frame")))),
            cal.body());
    }

    @Test
    void singleQuotedStrings() {
        Program program = parseStripped("defcalgrammar 'openpulse';\ninclude 'a.inc';");

        assertEquals(List.of(
            new CalibrationGrammarDeclaration("openpulse"),
            new Include("a.inc")), program.statements());
    }

    @Test
    void compoundAssignments() {
        Program program = parseStripped("cal { x = 1; x -= 2; x *= 3; x /= 4; }");

        CalibrationStatement cal = (CalibrationStatement) program.statements().get(0);
        assertEquals(List.of(AssignmentOperator.ASSIGN, AssignmentOperator.MINUS_ASSIGN,
                AssignmentOperator.TIMES_ASSIGN, AssignmentOperator.DIVIDE_ASSIGN),
            cal.body().stream().map(statement -> ((ClassicalAssignment) statement).op()).toList());
        assertEquals(new ClassicalAssignment(new Identifier("x"), AssignmentOperator.DIVIDE_ASSIGN,
            new IntegerLiteral(4)), cal.body().get(3));
    }

    @Test
    void unicodeIdentifiers() {
        Program program = parseStripped("cal { port π_drive; frame ψ = newframe(π_drive, 0); }");

        CalibrationStatement cal = (CalibrationStatement) program.statements().get(0);
        assertEquals(new ClassicalDeclaration(new FrameType(), new Identifier("ψ"),
            new FunctionCall(new Identifier("newframe"), List.of(new Identifier("π_drive"), new IntegerLiteral(0)))),
            cal.body().get(1));
    }

    @Test
    void parserInstanceIsSingleUse() {
        Parser parser = new Parser("OPENQASM 3.0; port p;");

        Program program = parser.parse();
        assertEquals("3.0", program.version());
        assertEquals(1, program.statements().size());

        assertThrows(IllegalStateException.class, parser::parse);
    }

    @Test
    void emptySourceParsesToEmptyProgram() {
        Program program = Parser.parse("  // nothing here\n");
        assertTrue(program.statements().isEmpty());
        assertNull(program.version());
        assertEquals(0, program.span().start());
    }
}
