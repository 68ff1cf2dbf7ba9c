package com.pulseparser;

/**
 * Raised when source text does not match the grammar. Parsing never recovers from a
 * syntax error: the first one aborts the parse and no partial tree is returned.
 */
public class ParseException extends RuntimeException {
    private final String errorType;
    private final Token token;
    private final TokenType expectedType;
    private final String expected;
    private final int position;
    private final int line;
    private final int column;
    private final String detail;

    public ParseException(String errorType, Token token, TokenType expectedType, String expected, String message) {
        this(errorType, token, expectedType, expected, message,
             token != null ? token.position() : 0,
             token != null ? token.line() : 0,
             token != null ? token.column() : 0);
    }

    /**
     * Constructor for errors raised before a token exists, such as an unterminated
     * string found by the lexer.
     */
    public ParseException(String errorType, String message, int position, int line, int column) {
        this(errorType, null, null, null, message, position, line, column);
    }

    private ParseException(String errorType, Token token, TokenType expectedType, String expected,
                           String message, int position, int line, int column) {
        super(formatMessage(errorType, message, line, column));
        this.errorType = errorType;
        this.token = token;
        this.expectedType = expectedType;
        this.expected = expected;
        this.position = position;
        this.line = line;
        this.column = column;
        this.detail = message;
    }

    private static String formatMessage(String errorType, String message, int line, int column) {
        return errorType + ": " + message + " at line " + line + ", column " + column;
    }

    public String getErrorType() {
        return errorType;
    }

    /**
     * The token at which recognition failed, or {@code null} for lexer errors.
     */
    public Token getToken() {
        return token;
    }

    public TokenType getExpectedType() {
        return expectedType;
    }

    /**
     * Description of the construct that was being recognized, if known.
     */
    public String getExpected() {
        return expected;
    }

    public int getPosition() {
        return position;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * The message without the error type and location prefix.
     */
    public String getDetail() {
        return detail;
    }
}
