package com.pulseparser;

import com.pulseparser.ast.*;
import com.pulseparser.tree.SpanGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for programs with calibration and pulse-level syntax.
 *
 * <p>This class holds the host grammar: the program header, includes, assignments,
 * expression and return statements, scalar types and the expression grammar. At
 * statement and type position it hands calibration-specific syntax to
 * {@link CalibrationGrammar}, which calls back into {@link #parseStatement()},
 * {@link #parseExpression()} and {@link #parseType()} for everything it does not own.</p>
 *
 * <p>A parser instance parses one source text once and is not thread-safe. Separate
 * instances share no state.</p>
 */
public class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    // ========================================================================
    // Binding Power Constants for Pratt Parser
    // ========================================================================
    // Higher binding power = tighter binding (higher precedence)
    private static final int BP_NONE = 0;           // Lowest - used as minimum for top-level
    private static final int BP_OR = 1;             // Logical OR (||)
    private static final int BP_AND = 2;            // Logical AND (&&)
    private static final int BP_BIT_OR = 3;         // Bitwise OR (|)
    private static final int BP_BIT_XOR = 4;        // Bitwise XOR (^)
    private static final int BP_BIT_AND = 5;        // Bitwise AND (&)
    private static final int BP_EQUALITY = 6;       // Equality (==, !=)
    private static final int BP_RELATIONAL = 7;     // Relational (<, <=, >, >=)
    private static final int BP_SHIFT = 8;          // Shift (<<, >>)
    private static final int BP_ADDITIVE = 9;       // Additive (+, -)
    private static final int BP_MULTIPLICATIVE = 10;// Multiplicative (*, /, %)
    private static final int BP_UNARY = 11;         // Prefix unary (-, ~, !)
    private static final int BP_POWER = 12;         // Power (**) - right-associative, binds tighter than prefix minus

    private final List<Token> tokens;
    private final SpanTracker spans;
    private final CalibrationGrammar calibration;
    private final boolean verifySpans;
    private int current = 0;
    private boolean parsed = false;

    public Parser(String source) {
        this(source, true);
    }

    /**
     * @param verifySpans run {@link SpanGuard} over the finished tree before returning it
     */
    public Parser(String source, boolean verifySpans) {
        this.verifySpans = verifySpans;
        this.tokens = new Lexer(source).tokenize();
        this.spans = new SpanTracker(source);
        this.calibration = new CalibrationGrammar(this);
    }

    /**
     * Parses the whole source. A parser instance parses once; calling this again throws
     * {@link IllegalStateException}.
     */
    public Program parse() {
        if (parsed) {
            throw new IllegalStateException("Parser instances are single-use; create a new Parser for each parse");
        }
        parsed = true;

        String version = null;
        if (check(TokenType.OPENQASM)) {
            version = parseVersionHeader();
        }

        List<Statement> statements = new ArrayList<>();
        while (!isAtEnd()) {
            statements.add(parseStatement());
        }

        Program program = new Program(spans.whole(), version, statements);
        if (verifySpans) {
            SpanGuard.check(program);
        }
        log.debug("Parsed {} top-level statements from {} tokens", statements.size(), tokens.size() - 1);
        return program;
    }

    private String parseVersionHeader() {
        advance(); // consume 'OPENQASM'
        Token versionToken = peek();
        if (versionToken.type() != TokenType.INTEGER_LITERAL && versionToken.type() != TokenType.FLOAT_LITERAL) {
            throw new ExpectedTokenException("Expected version number after 'OPENQASM'", versionToken);
        }
        advance();
        consume(TokenType.SEMICOLON, "Expected ';' after version header");
        return versionToken.lexeme();
    }

    // ========================================================================
    // Statements
    // ========================================================================

    /**
     * Parse a statement using switch dispatch. Calibration constructs, declarations
     * and loops go to {@link CalibrationGrammar}; everything else is a host statement.
     */
    Statement parseStatement() {
        Token token = peek();
        return switch (token.type()) {
            case CAL -> calibration.parseCalibrationBlock();
            case DEFCAL -> calibration.parseCalibrationDefinition();
            case DEFCALGRAMMAR -> calibration.parseCalibrationGrammar();
            case EXTERN -> calibration.parseExternDeclaration();
            case BARRIER -> calibration.parseBarrier();
            case DELAY -> calibration.parseDelay();
            case FOR -> calibration.parseForInLoop();
            case INT, UINT, FLOAT, ANGLE, BIT, BOOL, COMPLEX, DURATION,
                 PORT, FRAME, WAVEFORM -> calibration.parseClassicalDeclaration();

            case INCLUDE -> parseInclude();
            case RETURN -> parseReturnStatement();
            case OPENQASM -> throw new ParseException("SyntaxError", token, null, "statement",
                "The 'OPENQASM' version header must be the first statement");
            case IDENTIFIER -> parseIdentifierStatement(token);

            // Default: Parse as expression statement
            default -> parseExpressionStatement();
        };
    }

    /**
     * Parse a braced statement list. The closing brace is required; running out of
     * input reports the position of the opening brace in the message.
     */
    List<Statement> parseBlock(String context) {
        Token openBrace = consume(TokenType.LBRACE, "Expected '{' to open " + context);
        List<Statement> statements = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw new ExpectedTokenException(TokenType.RBRACE,
                    "Expected '}' to close " + context + " opened at line " + openBrace.line()
                        + ", column " + openBrace.column(),
                    peek());
            }
            statements.add(parseStatement());
        }
        advance(); // consume '}'
        return statements;
    }

    private Statement parseIdentifierStatement(Token startToken) {
        if (isAssignmentOperator(peekAhead(1).type())) {
            Identifier lvalue = parseIdentifier("Expected identifier");
            Token opToken = advance();
            Expression rvalue = parseExpression();
            consume(TokenType.SEMICOLON, "Expected ';' after assignment");
            return new ClassicalAssignment(spanFrom(startToken), lvalue,
                AssignmentOperator.fromSymbol(opToken.lexeme()), rvalue);
        }
        return parseExpressionStatement();
    }

    private ExpressionStatement parseExpressionStatement() {
        Token startToken = peek();
        Expression expression = parseExpression();
        consume(TokenType.SEMICOLON, "Expected ';' after expression");
        return new ExpressionStatement(spanFrom(startToken), expression);
    }

    private ReturnStatement parseReturnStatement() {
        Token startToken = peek();
        advance(); // consume 'return'

        Expression expression = null;
        if (!check(TokenType.SEMICOLON)) {
            expression = parseExpression();
        }

        consume(TokenType.SEMICOLON, "Expected ';' after return statement");
        return new ReturnStatement(spanFrom(startToken), expression);
    }

    private Include parseInclude() {
        Token startToken = peek();
        advance(); // consume 'include'
        Token filename = consume(TokenType.STRING_LITERAL, "Expected file name string after 'include'");
        consume(TokenType.SEMICOLON, "Expected ';' after include");
        return new Include(spanFrom(startToken), (String) filename.literal());
    }

    // ========================================================================
    // Types
    // ========================================================================

    TypeNode parseType() {
        Token startToken = peek();
        return switch (startToken.type()) {
            case INT -> {
                advance();
                Expression size = parseOptionalSize();
                yield new IntType(spanFrom(startToken), size);
            }
            case UINT -> {
                advance();
                Expression size = parseOptionalSize();
                yield new UintType(spanFrom(startToken), size);
            }
            case FLOAT -> {
                advance();
                Expression size = parseOptionalSize();
                yield new FloatType(spanFrom(startToken), size);
            }
            case ANGLE -> {
                advance();
                Expression size = parseOptionalSize();
                yield new AngleType(spanFrom(startToken), size);
            }
            case BIT -> {
                advance();
                Expression size = parseOptionalSize();
                yield new BitType(spanFrom(startToken), size);
            }
            case BOOL -> {
                advance();
                yield new BoolType(spanFrom(startToken));
            }
            case DURATION -> {
                advance();
                yield new DurationType(spanFrom(startToken));
            }
            case COMPLEX -> {
                advance();
                TypeNode baseType = null;
                if (match(TokenType.LBRACKET)) {
                    baseType = parseType();
                    consume(TokenType.RBRACKET, "Expected ']' after complex base type");
                }
                yield new ComplexType(spanFrom(startToken), baseType);
            }
            case PORT, FRAME, WAVEFORM -> calibration.parsePulseType();
            default -> throw new ExpectedTokenException("Expected a type", startToken);
        };
    }

    // Size designator: the bracketed expression in int[32], angle[20], float[size]
    private Expression parseOptionalSize() {
        if (!match(TokenType.LBRACKET)) {
            return null;
        }
        Expression size = parseExpression();
        consume(TokenType.RBRACKET, "Expected ']' after type size");
        return size;
    }

    // ========================================================================
    // Expressions - Pratt parser
    // ========================================================================
    // It parses expressions with binding power >= minBp.
    // 1. Parse a prefix expression (NUD)
    // 2. While the next token has binding power >= minBp, parse infix (LED)

    Expression parseExpression() {
        return parseExpr(BP_NONE);
    }

    private Expression parseExpr(int minBp) {
        Token startToken = peek();
        Expression left = parsePrefix();

        while (true) {
            Token token = peek();
            TokenType tt = token.type();
            int lbp = switch (tt) {
                case OR -> BP_OR;
                case AND -> BP_AND;
                case BIT_OR -> BP_BIT_OR;
                case BIT_XOR -> BP_BIT_XOR;
                case BIT_AND -> BP_BIT_AND;
                case EQ, NE -> BP_EQUALITY;
                case LT, LE, GT, GE -> BP_RELATIONAL;
                case LEFT_SHIFT, RIGHT_SHIFT -> BP_SHIFT;
                case PLUS, MINUS -> BP_ADDITIVE;
                case STAR, SLASH, PERCENT -> BP_MULTIPLICATIVE;
                case STAR_STAR -> BP_POWER;
                default -> -1; // Not an infix operator
            };

            if (lbp < 0 || lbp < minBp) {
                break;
            }

            advance();
            // Right-associative operators reparse at the same level
            Expression right = tt == TokenType.STAR_STAR ? parseExpr(lbp) : parseExpr(lbp + 1);
            left = new BinaryExpression(spanFrom(startToken), BinaryOperator.fromSymbol(token.lexeme()), left, right);
        }

        return left;
    }

    private Expression parsePrefix() {
        Token token = peek();
        advance();
        return switch (token.type()) {
            // Literals
            case INTEGER_LITERAL -> new IntegerLiteral(spans.of(token), (Long) token.literal());
            case FLOAT_LITERAL -> new FloatLiteral(spans.of(token), (Double) token.literal());
            case IMAGINARY_LITERAL -> new ImaginaryLiteral(spans.of(token), (Double) token.literal());
            case DURATION_LITERAL -> new DurationLiteral(spans.of(token), (Double) token.literal(), timeUnitOf(token));
            case TRUE -> new BooleanLiteral(spans.of(token), true);
            case FALSE -> new BooleanLiteral(spans.of(token), false);

            // Identifiers and calls
            case IDENTIFIER -> check(TokenType.LPAREN) ? parseFunctionCall(token) : new Identifier(spans.of(token), token.lexeme());
            case HARDWARE_QUBIT -> new Identifier(spans.of(token), token.lexeme());

            // Grouping
            case LPAREN -> {
                Expression inner = parseExpr(BP_NONE);
                consume(TokenType.RPAREN, "Expected ')' after expression");
                yield inner;
            }

            // Unary operators: the sign stays an operator and is never folded into a literal
            case MINUS, TILDE, BANG -> {
                Expression operand = parseExpr(BP_UNARY);
                yield new UnaryExpression(spanFrom(token), UnaryOperator.fromSymbol(token.lexeme()), operand);
            }

            default -> throw new UnexpectedTokenException(token, "expression");
        };
    }

    private FunctionCall parseFunctionCall(Token nameToken) {
        Identifier name = new Identifier(spans.of(nameToken), nameToken.lexeme());
        consume(TokenType.LPAREN, "Expected '(' after function name");
        List<Expression> arguments = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                arguments.add(parseExpression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expected ')' after function arguments");
        return new FunctionCall(spanFrom(nameToken), name, arguments);
    }

    private static TimeUnit timeUnitOf(Token token) {
        String lexeme = token.lexeme();
        int suffixStart = lexeme.length();
        while (suffixStart > 0 && Character.isLetter(lexeme.charAt(suffixStart - 1))) {
            suffixStart--;
        }
        return TimeUnit.fromSuffix(lexeme.substring(suffixStart));
    }

    // ========================================================================
    // Helper methods shared with CalibrationGrammar
    // ========================================================================

    Identifier parseIdentifier(String message) {
        Token token = consume(TokenType.IDENTIFIER, message);
        return new Identifier(spans.of(token), token.lexeme());
    }

    /**
     * Span from {@code startToken} to the last consumed token.
     */
    Span spanFrom(Token startToken) {
        return spans.between(startToken, previous());
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    boolean check(TokenType type) {
        return peek().type() == type;
    }

    Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    Token peek() {
        return tokens.get(current);
    }

    Token peekAhead(int offset) {
        int pos = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(pos);
    }

    Token previous() {
        return tokens.get(Math.max(current - 1, 0));
    }

    Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ExpectedTokenException(type, message, peek());
    }

    private static boolean isAssignmentOperator(TokenType type) {
        return type == TokenType.ASSIGN || type == TokenType.PLUS_ASSIGN || type == TokenType.MINUS_ASSIGN
            || type == TokenType.STAR_ASSIGN || type == TokenType.SLASH_ASSIGN;
    }

    public static Program parse(String source) {
        return new Parser(source).parse();
    }

    public static Program parse(String source, boolean verifySpans) {
        return new Parser(source, verifySpans).parse();
    }
}
