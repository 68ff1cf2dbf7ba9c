package com.pulseparser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String source) {
        return new Lexer(source).tokenize().stream().map(Token::type).toList();
    }

    @Test
    void keywordsAndIdentifiers() {
        assertEquals(List.of(TokenType.DEFCAL, TokenType.IDENTIFIER, TokenType.HARDWARE_QUBIT,
                TokenType.LBRACE, TokenType.RBRACE, TokenType.EOF),
            types("defcal calibrate $12 { }"));
        assertEquals(List.of(TokenType.PORT, TokenType.FRAME, TokenType.WAVEFORM, TokenType.IDENTIFIER, TokenType.EOF),
            types("port frame waveform portal"));
    }

    @Test
    void numericLiterals() {
        List<Token> tokens = new Lexer("42 0x2A 0b101 1_000 2.5 .5 1e-3 3im 1.5im").tokenize();

        assertEquals(42L, tokens.get(0).literal());
        assertEquals(42L, tokens.get(1).literal());
        assertEquals(5L, tokens.get(2).literal());
        assertEquals(1000L, tokens.get(3).literal());
        assertEquals(TokenType.FLOAT_LITERAL, tokens.get(4).type());
        assertEquals(0.5, tokens.get(5).literal());
        assertEquals(0.001, tokens.get(6).literal());
        assertEquals(TokenType.IMAGINARY_LITERAL, tokens.get(7).type());
        assertEquals(3.0, tokens.get(7).literal());
        assertEquals(1.5, tokens.get(8).literal());
    }

    @Test
    void octalLiteral() {
        Token token = new Lexer("0o17").tokenize().get(0);

        assertEquals(TokenType.INTEGER_LITERAL, token.type());
        assertEquals(15L, token.literal());
    }

    @Test
    void radixPrefixWithoutDigits() {
        ParseException e = assertThrows(ParseException.class, () -> new Lexer("int x = 0x_;").tokenize());

        assertEquals("Missing digits in integer literal", e.getDetail());
        assertEquals(8, e.getColumn());
    }

    @Test
    void unicodeIdentifiers() {
        List<Token> tokens = new Lexer("π_drive ψ0 résumé").tokenize();

        assertEquals(List.of("π_drive", "ψ0", "résumé"),
            tokens.subList(0, 3).stream().map(Token::lexeme).toList());
        assertTrue(tokens.subList(0, 3).stream().allMatch(t -> t.type() == TokenType.IDENTIFIER));
    }

    @Test
    void singleQuotedString() {
        Token token = new Lexer("'a.inc'").tokenize().get(0);

        assertEquals(TokenType.STRING_LITERAL, token.type());
        assertEquals("a.inc", token.literal());
    }

    @Test
    void tokenizeIsRepeatable() {
        Lexer lexer = new Lexer("port p;");

        List<Token> first = lexer.tokenize();
        List<Token> second = lexer.tokenize();

        assertEquals(4, first.size());
        assertEquals(first, second);
        assertThrows(UnsupportedOperationException.class, () -> first.add(first.get(0)));
    }

    @Test
    void durationSuffixesMustBeAttached() {
        List<Token> tokens = new Lexer("100ns 2.5us 3µs 4ms 1s 160dt 5 s").tokenize();

        for (int i = 0; i < 6; i++) {
            assertEquals(TokenType.DURATION_LITERAL, tokens.get(i).type(), tokens.get(i).lexeme());
        }
        assertEquals("3µs", tokens.get(2).lexeme());
        assertEquals(TokenType.INTEGER_LITERAL, tokens.get(6).type());
        assertEquals(TokenType.IDENTIFIER, tokens.get(7).type());
    }

    @Test
    void suffixFollowedByLettersIsNotAUnit() {
        assertEquals(List.of(TokenType.INTEGER_LITERAL, TokenType.IDENTIFIER, TokenType.EOF), types("5sec"));
    }

    @Test
    void operators() {
        assertEquals(List.of(TokenType.ARROW, TokenType.STAR_STAR, TokenType.LEFT_SHIFT, TokenType.GE,
                TokenType.AND, TokenType.BIT_OR, TokenType.PLUS_ASSIGN, TokenType.NE, TokenType.EOF),
            types("-> ** << >= && | += !="));
    }

    @Test
    void commentsAreSkipped() {
        assertEquals(List.of(TokenType.PORT, TokenType.IDENTIFIER, TokenType.SEMICOLON, TokenType.EOF),
            types("// line\nport /* block\n comment */ p;"));
    }

    @Test
    void positionsTrackLinesAndColumns() {
        List<Token> tokens = new Lexer("cal {\r\n  port p;\n}").tokenize();

        Token port = tokens.get(2);
        assertEquals(2, port.line());
        assertEquals(2, port.column());
        assertEquals(9, port.position());
        assertEquals(13, port.endPosition());

        Token close = tokens.get(5);
        assertEquals(3, close.line());
        assertEquals(0, close.column());
    }

    @Test
    void unterminatedBlockComment() {
        ParseException e = assertThrows(ParseException.class, () -> new Lexer("port p; /* open").tokenize());

        assertEquals("Unterminated block comment", e.getDetail());
        assertEquals(8, e.getColumn());
    }

    @Test
    void unexpectedCharacter() {
        ParseException e = assertThrows(ParseException.class, () -> new Lexer("port @p;").tokenize());

        assertEquals("Unexpected character '@'", e.getDetail());
        assertEquals(5, e.getPosition());
    }
}
