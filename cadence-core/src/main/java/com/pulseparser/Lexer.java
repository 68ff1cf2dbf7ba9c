package com.pulseparser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns source text into a list of tokens terminated by {@link TokenType#EOF}.
 *
 * <p>Whitespace, {@code //} line comments and {@code /* *}{@code /} block comments are
 * skipped. Numeric literals are classified here: a decimal point or an exponent makes
 * a float, an {@code im} suffix makes an imaginary literal and a time unit suffix
 * ({@code ns, us, µs, ms, s, dt}) makes a duration literal. Suffixes must be attached
 * to the number.</p>
 */
public class Lexer {
    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        KEYWORDS.put("OPENQASM", TokenType.OPENQASM);
        KEYWORDS.put("include", TokenType.INCLUDE);
        KEYWORDS.put("defcalgrammar", TokenType.DEFCALGRAMMAR);
        KEYWORDS.put("cal", TokenType.CAL);
        KEYWORDS.put("defcal", TokenType.DEFCAL);
        KEYWORDS.put("extern", TokenType.EXTERN);
        KEYWORDS.put("barrier", TokenType.BARRIER);
        KEYWORDS.put("delay", TokenType.DELAY);
        KEYWORDS.put("return", TokenType.RETURN);
        KEYWORDS.put("for", TokenType.FOR);
        KEYWORDS.put("in", TokenType.IN);
        KEYWORDS.put("int", TokenType.INT);
        KEYWORDS.put("uint", TokenType.UINT);
        KEYWORDS.put("float", TokenType.FLOAT);
        KEYWORDS.put("angle", TokenType.ANGLE);
        KEYWORDS.put("bit", TokenType.BIT);
        KEYWORDS.put("bool", TokenType.BOOL);
        KEYWORDS.put("complex", TokenType.COMPLEX);
        KEYWORDS.put("duration", TokenType.DURATION);
        KEYWORDS.put("port", TokenType.PORT);
        KEYWORDS.put("frame", TokenType.FRAME);
        KEYWORDS.put("waveform", TokenType.WAVEFORM);
        KEYWORDS.put("true", TokenType.TRUE);
        KEYWORDS.put("false", TokenType.FALSE);
    }

    // Longest suffixes first so "ms" is not read as "m" + "s"
    private static final String[] TIME_UNIT_SUFFIXES = {"ns", "us", "µs", "ms", "dt", "s"};

    private final String source;
    private final int length;
    private final List<Token> tokens = new ArrayList<>();

    private int position = 0;
    private int line = 1;
    private int column = 0;

    // Start of the token being scanned
    private int tokenStart;
    private int tokenLine;
    private int tokenColumn;

    public Lexer(String source) {
        this.source = source;
        this.length = source.length();
    }

    /**
     * Scans the source once. Later calls return the same tokens.
     */
    public List<Token> tokenize() {
        if (!tokens.isEmpty()) {
            return List.copyOf(tokens);
        }
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                tokens.add(new Token(TokenType.EOF, "", null, line, column, position, position, line, column));
                return List.copyOf(tokens);
            }
            markTokenStart();
            scanToken();
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> addToken(TokenType.LPAREN);
            case ')' -> addToken(TokenType.RPAREN);
            case '{' -> addToken(TokenType.LBRACE);
            case '}' -> addToken(TokenType.RBRACE);
            case '[' -> addToken(TokenType.LBRACKET);
            case ']' -> addToken(TokenType.RBRACKET);
            case ',' -> addToken(TokenType.COMMA);
            case ';' -> addToken(TokenType.SEMICOLON);
            case ':' -> addToken(TokenType.COLON);
            case '~' -> addToken(TokenType.TILDE);
            case '%' -> addToken(TokenType.PERCENT);
            case '^' -> addToken(TokenType.BIT_XOR);
            case '-' -> {
                if (match('>')) {
                    addToken(TokenType.ARROW);
                } else if (match('=')) {
                    addToken(TokenType.MINUS_ASSIGN);
                } else {
                    addToken(TokenType.MINUS);
                }
            }
            case '+' -> addToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
            case '*' -> {
                if (match('*')) {
                    addToken(TokenType.STAR_STAR);
                } else if (match('=')) {
                    addToken(TokenType.STAR_ASSIGN);
                } else {
                    addToken(TokenType.STAR);
                }
            }
            case '/' -> addToken(match('=') ? TokenType.SLASH_ASSIGN : TokenType.SLASH);
            case '!' -> addToken(match('=') ? TokenType.NE : TokenType.BANG);
            case '=' -> addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
            case '<' -> {
                if (match('<')) {
                    addToken(TokenType.LEFT_SHIFT);
                } else if (match('=')) {
                    addToken(TokenType.LE);
                } else {
                    addToken(TokenType.LT);
                }
            }
            case '>' -> {
                if (match('>')) {
                    addToken(TokenType.RIGHT_SHIFT);
                } else if (match('=')) {
                    addToken(TokenType.GE);
                } else {
                    addToken(TokenType.GT);
                }
            }
            case '&' -> addToken(match('&') ? TokenType.AND : TokenType.BIT_AND);
            case '|' -> addToken(match('|') ? TokenType.OR : TokenType.BIT_OR);
            case '"', '\'' -> scanString(c);
            case '$' -> scanHardwareQubit();
            default -> {
                if (isDigit(c) || (c == '.' && isDigit(peek()))) {
                    scanNumber(c);
                } else if (isIdentifierStart(c)) {
                    scanIdentifier();
                } else {
                    throw error("Unexpected character '" + c + "'");
                }
            }
        }
    }

    private void scanIdentifier() {
        while (isIdentifierPart(peek())) {
            advance();
        }
        String text = source.substring(tokenStart, position);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void scanHardwareQubit() {
        if (!isDigit(peek())) {
            throw error("Expected digits after '$' in hardware qubit");
        }
        while (isDigit(peek())) {
            advance();
        }
        addToken(TokenType.HARDWARE_QUBIT);
    }

    private void scanString(char quote) {
        while (peek() != quote) {
            if (isAtEnd() || peek() == '\n' || peek() == '\r') {
                throw error("Unterminated string literal");
            }
            advance();
        }
        advance(); // closing quote
        String value = source.substring(tokenStart + 1, position - 1);
        addToken(TokenType.STRING_LITERAL, value);
    }

    private void scanNumber(char first) {
        // Hex, octal and binary integers
        if (first == '0' && (peek() == 'x' || peek() == 'X' || peek() == 'o' || peek() == 'O'
                || peek() == 'b' || peek() == 'B')) {
            char marker = Character.toLowerCase(advance());
            int radix = marker == 'x' ? 16 : marker == 'o' ? 8 : 2;
            int digitsStart = position;
            while (Character.digit(peek(), radix) >= 0 || peek() == '_') {
                advance();
            }
            String digits = source.substring(digitsStart, position).replace("_", "");
            if (digits.isEmpty()) {
                throw error("Missing digits in integer literal");
            }
            addToken(TokenType.INTEGER_LITERAL, parseInteger(digits, radix));
            return;
        }

        boolean isFloat = first == '.';
        consumeDecimalDigits();
        if (!isFloat && peek() == '.') {
            isFloat = true;
            advance();
            consumeDecimalDigits();
        }
        if (peek() == 'e' || peek() == 'E') {
            char next = peekNext();
            if (isDigit(next) || ((next == '+' || next == '-') && isDigit(peekAt(2)))) {
                isFloat = true;
                advance();
                if (peek() == '+' || peek() == '-') {
                    advance();
                }
                consumeDecimalDigits();
            }
        }

        String numberText = source.substring(tokenStart, position).replace("_", "");

        if (matchSuffix("im")) {
            addToken(TokenType.IMAGINARY_LITERAL, Double.parseDouble(numberText));
            return;
        }
        for (String unit : TIME_UNIT_SUFFIXES) {
            if (matchSuffix(unit)) {
                addToken(TokenType.DURATION_LITERAL, Double.parseDouble(numberText));
                return;
            }
        }

        if (isFloat) {
            addToken(TokenType.FLOAT_LITERAL, Double.parseDouble(numberText));
        } else {
            addToken(TokenType.INTEGER_LITERAL, parseInteger(numberText, 10));
        }
    }

    private void consumeDecimalDigits() {
        while (isDigit(peek()) || (peek() == '_' && isDigit(peekNext()))) {
            advance();
        }
    }

    private Long parseInteger(String digits, int radix) {
        try {
            return Long.parseLong(digits, radix);
        } catch (NumberFormatException e) {
            throw error("Integer literal out of range: " + source.substring(tokenStart, position));
        }
    }

    /**
     * Consumes {@code suffix} if it directly follows the current position and is not
     * itself the start of a longer identifier.
     */
    private boolean matchSuffix(String suffix) {
        if (!source.startsWith(suffix, position)) {
            return false;
        }
        int after = position + suffix.length();
        if (after < length && isIdentifierPart(source.charAt(after))) {
            return false;
        }
        for (int i = 0; i < suffix.length(); i++) {
            advance();
        }
        return true;
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n' && peek() != '\r') {
                    advance();
                }
            } else if (c == '/' && peekNext() == '*') {
                markTokenStart();
                advance();
                advance();
                while (!(peek() == '*' && peekNext() == '/')) {
                    if (isAtEnd()) {
                        throw error("Unterminated block comment");
                    }
                    advance();
                }
                advance();
                advance();
            } else {
                return;
            }
        }
    }

    private void markTokenStart() {
        tokenStart = position;
        tokenLine = line;
        tokenColumn = column;
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(tokenStart, position);
        tokens.add(new Token(type, lexeme, literal, tokenLine, tokenColumn, tokenStart, position, line, column));
    }

    private ParseException error(String message) {
        return new ParseException("SyntaxError", message, tokenStart, tokenLine, tokenColumn);
    }

    private char advance() {
        char c = source.charAt(position++);
        if (c == '\n') {
            line++;
            column = 0;
        } else if (c == '\r' && peek() != '\n') {
            // Lone CR is a line terminator; for CRLF the LF ends the line
            line++;
            column = 0;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (peek() != expected) {
            return false;
        }
        advance();
        return true;
    }

    private boolean isAtEnd() {
        return position >= length;
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        int index = position + offset;
        return index < length ? source.charAt(index) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
