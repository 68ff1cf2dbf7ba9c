package com.pulseparser;

import com.pulseparser.ast.*;
import com.pulseparser.tree.InvariantViolationException;
import com.pulseparser.tree.SpanGuard;
import com.pulseparser.tree.SpanStripper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SpanTest {

    private static final String DEFCAL = "defcal rz(angle[20] theta) $1 { return shift_phase(drive($1), -theta); }";

    @Test
    void spansSliceTheExactSourceText() {
        Program program = Parser.parse(DEFCAL);
        CalibrationDefinition defcal = (CalibrationDefinition) program.statements().get(0);

        assertEquals(DEFCAL, defcal.span().text(DEFCAL));
        assertEquals("rz", defcal.name().span().text(DEFCAL));
        assertEquals("angle[20] theta", defcal.arguments().get(0).span().text(DEFCAL));
        assertEquals("angle[20]", defcal.arguments().get(0).type().span().text(DEFCAL));
        assertEquals("$1", defcal.qubits().get(0).span().text(DEFCAL));

        ReturnStatement ret = (ReturnStatement) defcal.body().get(0);
        assertEquals("return shift_phase(drive($1), -theta);", ret.span().text(DEFCAL));

        FunctionCall call = (FunctionCall) ret.expression();
        assertEquals("shift_phase(drive($1), -theta)", call.span().text(DEFCAL));
        assertEquals("-theta", call.arguments().get(1).span().text(DEFCAL));
    }

    @Test
    void childSpansLieWithinTheirParent() {
        String source = String.join("\n",
            "cal {",
            "    frame f = newframe(p, 5.0e9, 0);",
            "    for int i in [0:3] { play(wf, f); }",
            "}");
        Program program = Parser.parse(source);
        CalibrationStatement cal = (CalibrationStatement) program.statements().get(0);

        assertTrue(program.span().contains(cal.span()));
        for (Statement statement : cal.body()) {
            assertTrue(cal.span().contains(statement.span()), statement.kind());
        }
        ForInLoop loop = (ForInLoop) cal.body().get(1);
        assertEquals("[0:3]", loop.setDeclaration().span().text(source));
        assertEquals(3, loop.span().startLine());
        assertEquals(4, loop.span().startColumn());
    }

    @Test
    void spansCoverInteriorWhitespaceAndComments() {
        String source = "cal {\n  port /* the drive line */ p ;\n}";
        Program program = Parser.parse(source);
        CalibrationStatement cal = (CalibrationStatement) program.statements().get(0);

        assertEquals("port /* the drive line */ p ;", cal.body().get(0).span().text(source));
        assertEquals(1, cal.span().startLine());
        assertEquals(3, cal.span().endLine());
        assertEquals(1, cal.span().endColumn());
    }

    @Test
    void statementSlicesReparseToTheSameStatement() {
        String source = String.join("\n",
            "defcalgrammar \"openpulse\";",
            "cal { port p; frame f = newframe(p, 0); }",
            DEFCAL,
            "for int i in [0:10:2] { delay[4dt] f; barrier f; }");
        Program program = Parser.parse(source);

        for (Statement statement : program.statements()) {
            Program reparsed = Parser.parse(statement.span().text(source));
            assertEquals(List.of(SpanStripper.strip(statement)), SpanStripper.strip(reparsed).statements());
        }
    }

    @Test
    void parsingIsDeterministic() {
        Program first = Parser.parse(DEFCAL);
        Program second = Parser.parse(DEFCAL);

        assertEquals(first, second);
    }

    @Test
    void whitespaceDoesNotChangeTheStrippedTree() {
        String compact = "cal{port p;frame f=newframe(p,0);barrier f;}";
        String spread = "cal {\n    port p;\n    frame f = newframe( p , 0 ) ;\n\n    barrier   f;\n}\n";

        Program a = Parser.parse(compact);
        Program b = Parser.parse(spread);

        assertNotEquals(a, b);
        assertEquals(SpanStripper.strip(a), SpanStripper.strip(b));
        assertTrue(SpanStripper.structurallyEqual(a, b));
    }

    @Test
    void strippedTreeHasNoSpans() {
        Program stripped = SpanStripper.strip(Parser.parse(DEFCAL));

        assertNull(stripped.span());
        InvariantViolationException e = assertThrows(InvariantViolationException.class,
            () -> SpanGuard.check(stripped));
        assertEquals("Program", e.getNodeKind());
        assertNull(e.getAncestorSpan());
    }

    @Test
    void spanGuardNamesTheNodeMissingItsSpan() {
        Span outer = new Span(0, 20, 1, 0, 1, 20);
        Span inner = new Span(6, 18, 1, 6, 1, 18);
        Program program = new Program(outer, null, List.of(
            new QuantumBarrier(inner, List.of(new Identifier("q0")))));

        InvariantViolationException e = assertThrows(InvariantViolationException.class,
            () -> SpanGuard.check(program));
        assertEquals("Identifier", e.getNodeKind());
        assertEquals(inner, e.getAncestorSpan());
        assertTrue(e.getMessage().contains("Identifier"));
    }

    @Test
    void invalidSpanIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Span(5, 2, 1, 5, 1, 2));
    }
}
