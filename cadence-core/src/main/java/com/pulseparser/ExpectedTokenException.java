package com.pulseparser;

public class ExpectedTokenException extends ParseException {
    public ExpectedTokenException(String expected, Token actual) {
        super("SyntaxError", actual, null, expected,
              expected + (actual != null ? " but found " + describe(actual) : ""));
    }

    public ExpectedTokenException(TokenType expectedType, String expected, Token actual) {
        super("SyntaxError", actual, expectedType, expected,
              expected + (actual != null ? " but found " + describe(actual) : ""));
    }

    static String describe(Token token) {
        return token.type() == TokenType.EOF ? "end of input" : "'" + token.lexeme() + "'";
    }
}
