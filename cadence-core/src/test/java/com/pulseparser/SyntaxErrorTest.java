package com.pulseparser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SyntaxErrorTest {

    private static ParseException parseError(String source) {
        return assertThrows(ParseException.class, () -> Parser.parse(source));
    }

    @Test
    void unterminatedCalibrationBlock() {
        String source = "cal {\n    port q0;\n    frame f = newframe(q0, 0);\n";
        ParseException e = parseError(source);

        assertEquals("SyntaxError", e.getErrorType());
        assertEquals(TokenType.RBRACE, e.getExpectedType());
        assertTrue(e.getPosition() >= source.indexOf('{'));
        assertTrue(e.getMessage().contains("opened at line 1, column 4"), e.getMessage());
    }

    @Test
    void missingSemicolon() {
        ParseException e = parseError("cal { port q0 }");

        assertInstanceOf(ExpectedTokenException.class, e);
        assertEquals(TokenType.SEMICOLON, e.getExpectedType());
        assertEquals("}", e.getToken().lexeme());
        assertEquals(14, e.getColumn());
        assertEquals("Expected ';' after declaration", e.getExpected());
    }

    @Test
    void externArgumentsMustNotBeNamed() {
        ParseException e = parseError("extern drag(duration d) -> waveform;");

        assertEquals("d", e.getToken().lexeme());
        assertTrue(e.getDetail().startsWith("Expected ',' or ')'"), e.getDetail());
    }

    @Test
    void defcalNeedsAQubit() {
        ParseException e = parseError("defcal x { }");

        assertEquals("{", e.getToken().lexeme());
    }

    @Test
    void delayNeedsBracketedDuration() {
        ParseException e = parseError("delay 100ns q0;");

        assertEquals(TokenType.LBRACKET, e.getExpectedType());
    }

    @Test
    void unexpectedTokenInExpression() {
        ParseException e = parseError("cal { ; }");

        assertInstanceOf(UnexpectedTokenException.class, e);
        assertEquals("Unexpected ';' in expression", e.getDetail());
        assertEquals("expression", e.getExpected());
        assertEquals(1, e.getLine());
        assertEquals(6, e.getColumn());
    }

    @Test
    void versionHeaderOnlyFirst() {
        ParseException e = parseError("port p;\nOPENQASM 3;");

        assertEquals(2, e.getLine());
    }

    @Test
    void lexerErrorsCarryTheirPosition() {
        ParseException e = parseError("cal {\n  include \"missing.inc;\n}");

        assertNull(e.getToken());
        assertEquals(2, e.getLine());
        assertEquals(10, e.getColumn());
        assertEquals("SyntaxError: Unterminated string literal at line 2, column 10", e.getMessage());
    }

    @Test
    void integerOverflowIsASyntaxError() {
        ParseException e = parseError("int x = 99999999999999999999;");

        assertTrue(e.getDetail().startsWith("Integer literal out of range"), e.getDetail());
    }

    @Test
    void sameInputSameError() {
        ParseException first = parseError("cal { barrier q0 q1; }");
        ParseException second = parseError("cal { barrier q0 q1; }");

        assertEquals(first.getMessage(), second.getMessage());
        assertEquals(first.getPosition(), second.getPosition());
    }
}
