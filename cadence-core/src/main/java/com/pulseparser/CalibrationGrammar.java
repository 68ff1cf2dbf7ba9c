package com.pulseparser;

import com.pulseparser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Grammar rules for calibration and pulse-level syntax.
 *
 * <p>Each rule starts at the current token of the shared {@link Parser}, consumes its
 * construct and returns the node stamped with the span of the consumed tokens, or
 * throws a {@link ParseException} at the token where recognition failed. General
 * expressions, types and nested statements are parsed by calling back into the
 * parser, so calibration blocks, loops and definitions nest arbitrarily.</p>
 */
final class CalibrationGrammar {
    private final Parser p;

    CalibrationGrammar(Parser parser) {
        this.p = parser;
    }

    // cal { <statements> }
    CalibrationStatement parseCalibrationBlock() {
        Token startToken = p.peek();
        p.advance(); // consume 'cal'
        List<Statement> body = p.parseBlock("calibration block");
        return new CalibrationStatement(p.spanFrom(startToken), body);
    }

    // defcal <name> [( <type> <name>, ... )] <qubit>, ... [-> <type>] { <body> }
    CalibrationDefinition parseCalibrationDefinition() {
        Token startToken = p.peek();
        p.advance(); // consume 'defcal'

        Identifier name = p.parseIdentifier("Expected calibration name after 'defcal'");

        List<ClassicalArgument> arguments = new ArrayList<>();
        if (p.match(TokenType.LPAREN)) {
            if (!p.check(TokenType.RPAREN)) {
                do {
                    arguments.add(parseClassicalArgument());
                } while (p.match(TokenType.COMMA));
            }
            p.consume(TokenType.RPAREN, "Expected ')' after calibration arguments");
        }

        List<Identifier> qubits = new ArrayList<>();
        do {
            qubits.add(parseQubit("Expected qubit in calibration definition"));
        } while (p.match(TokenType.COMMA));

        TypeNode returnType = null;
        if (p.match(TokenType.ARROW)) {
            returnType = p.parseType();
        }

        List<Statement> body = p.parseBlock("calibration definition body");
        return new CalibrationDefinition(p.spanFrom(startToken), name, arguments, qubits, returnType, body);
    }

    private ClassicalArgument parseClassicalArgument() {
        Token startToken = p.peek();
        TypeNode type = p.parseType();
        Identifier name = p.parseIdentifier("Expected argument name after type");
        return new ClassicalArgument(p.spanFrom(startToken), type, name);
    }

    // defcalgrammar "<name>";
    CalibrationGrammarDeclaration parseCalibrationGrammar() {
        Token startToken = p.peek();
        p.advance(); // consume 'defcalgrammar'
        Token name = p.consume(TokenType.STRING_LITERAL, "Expected grammar name string after 'defcalgrammar'");
        p.consume(TokenType.SEMICOLON, "Expected ';' after calibration grammar declaration");
        return new CalibrationGrammarDeclaration(p.spanFrom(startToken), (String) name.literal());
    }

    // extern <name> ( <type>, ... ) [-> <type>];
    ExternDeclaration parseExternDeclaration() {
        Token startToken = p.peek();
        p.advance(); // consume 'extern'

        Identifier name = p.parseIdentifier("Expected extern name after 'extern'");
        p.consume(TokenType.LPAREN, "Expected '(' after extern name");

        List<ExternArgument> arguments = new ArrayList<>();
        if (!p.check(TokenType.RPAREN)) {
            do {
                Token argStart = p.peek();
                TypeNode type = p.parseType();
                if (p.check(TokenType.IDENTIFIER)) {
                    // extern signatures list types only
                    throw new ExpectedTokenException("Expected ',' or ')' after extern argument type", p.peek());
                }
                arguments.add(new ExternArgument(p.spanFrom(argStart), type));
            } while (p.match(TokenType.COMMA));
        }
        p.consume(TokenType.RPAREN, "Expected ')' after extern argument types");

        TypeNode returnType = null;
        if (p.match(TokenType.ARROW)) {
            returnType = p.parseType();
        }
        p.consume(TokenType.SEMICOLON, "Expected ';' after extern declaration");
        return new ExternDeclaration(p.spanFrom(startToken), name, arguments, returnType);
    }

    // <type> <identifier> [= <expression>];
    ClassicalDeclaration parseClassicalDeclaration() {
        Token startToken = p.peek();
        TypeNode type = p.parseType();
        Identifier identifier = p.parseIdentifier("Expected identifier after type in declaration");

        Expression initExpression = null;
        if (p.match(TokenType.ASSIGN)) {
            initExpression = p.parseExpression();
        }

        p.consume(TokenType.SEMICOLON, "Expected ';' after declaration");
        return new ClassicalDeclaration(p.spanFrom(startToken), type, identifier, initExpression);
    }

    // for <type> <identifier> in <set> <body>
    ForInLoop parseForInLoop() {
        Token startToken = p.peek();
        p.advance(); // consume 'for'

        TypeNode type = p.parseType();
        Identifier identifier = p.parseIdentifier("Expected loop variable after type in for loop");
        p.consume(TokenType.IN, "Expected 'in' after loop variable");

        SetDeclaration setDeclaration = parseSetDeclaration();

        List<Statement> block;
        if (p.check(TokenType.LBRACE)) {
            block = p.parseBlock("for loop body");
        } else {
            block = List.of(p.parseStatement());
        }
        return new ForInLoop(p.spanFrom(startToken), type, identifier, setDeclaration, block);
    }

    private SetDeclaration parseSetDeclaration() {
        Token startToken = p.peek();

        // [start:end] or [start:end:step]
        if (p.match(TokenType.LBRACKET)) {
            Expression start = p.parseExpression();
            p.consume(TokenType.COLON, "Expected ':' in range definition");
            Expression end = p.parseExpression();
            Expression step = null;
            if (p.match(TokenType.COLON)) {
                step = p.parseExpression();
            }
            p.consume(TokenType.RBRACKET, "Expected ']' after range definition");
            return new RangeDefinition(p.spanFrom(startToken), start, end, step);
        }

        // {a, b, c}
        if (p.match(TokenType.LBRACE)) {
            List<Expression> values = new ArrayList<>();
            if (!p.check(TokenType.RBRACE)) {
                do {
                    values.add(p.parseExpression());
                } while (p.match(TokenType.COMMA));
            }
            p.consume(TokenType.RBRACE, "Expected '}' after discrete set");
            return new DiscreteSet(p.spanFrom(startToken), values);
        }

        return p.parseExpression();
    }

    // barrier [<target>, ...];
    QuantumBarrier parseBarrier() {
        Token startToken = p.peek();
        p.advance(); // consume 'barrier'
        List<Identifier> qubits = parseTargets("barrier");
        p.consume(TokenType.SEMICOLON, "Expected ';' after barrier");
        return new QuantumBarrier(p.spanFrom(startToken), qubits);
    }

    // delay[<duration>] [<target>, ...];
    QuantumDelay parseDelay() {
        Token startToken = p.peek();
        p.advance(); // consume 'delay'
        p.consume(TokenType.LBRACKET, "Expected '[' after 'delay'");
        Expression duration = p.parseExpression();
        p.consume(TokenType.RBRACKET, "Expected ']' after delay duration");
        List<Identifier> qubits = parseTargets("delay");
        p.consume(TokenType.SEMICOLON, "Expected ';' after delay");
        return new QuantumDelay(p.spanFrom(startToken), duration, qubits);
    }

    // port | frame | waveform
    TypeNode parsePulseType() {
        Token token = p.advance();
        Span span = p.spanFrom(token);
        return switch (token.type()) {
            case PORT -> new PortType(span);
            case FRAME -> new FrameType(span);
            case WAVEFORM -> new WaveformType(span);
            default -> throw new ExpectedTokenException("Expected 'port', 'frame' or 'waveform'", token);
        };
    }

    // Zero or more comma-separated qubit or frame names; none means every target
    private List<Identifier> parseTargets(String context) {
        List<Identifier> targets = new ArrayList<>();
        if (p.check(TokenType.SEMICOLON)) {
            return targets;
        }
        do {
            targets.add(parseQubit("Expected qubit or frame in " + context));
        } while (p.match(TokenType.COMMA));
        return targets;
    }

    private Identifier parseQubit(String message) {
        Token token = p.peek();
        if (token.type() != TokenType.IDENTIFIER && token.type() != TokenType.HARDWARE_QUBIT) {
            throw new ExpectedTokenException(message, token);
        }
        p.advance();
        return new Identifier(p.spanFrom(token), token.lexeme());
    }
}
