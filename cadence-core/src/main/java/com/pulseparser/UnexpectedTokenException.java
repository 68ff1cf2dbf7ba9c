package com.pulseparser;

public class UnexpectedTokenException extends ParseException {
    public UnexpectedTokenException(Token token, String context) {
        super("SyntaxError", token, null, context,
              "Unexpected " + ExpectedTokenException.describe(token) + " in " + context);
    }
}
