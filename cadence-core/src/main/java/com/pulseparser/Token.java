package com.pulseparser;

/**
 * A lexical token.
 *
 * @param type        token kind
 * @param lexeme      exact source text of the token
 * @param literal     decoded value for literals ({@link Long}, {@link Double} or {@link String}), else {@code null}
 * @param line        1-based line of the first character
 * @param column      0-based column of the first character
 * @param position    offset of the first character
 * @param endPosition offset after the last character
 * @param endLine     1-based line of {@code endPosition}
 * @param endColumn   0-based column of {@code endPosition}
 */
public record Token(
    TokenType type,
    String lexeme,
    Object literal,
    int line,
    int column,
    int position,
    int endPosition,
    int endLine,
    int endColumn
) {
    @Override
    public String toString() {
        return type + " '" + lexeme + "' at " + line + ":" + column;
    }
}
