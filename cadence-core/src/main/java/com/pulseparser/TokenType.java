package com.pulseparser;

public enum TokenType {
    // Literals
    INTEGER_LITERAL,
    FLOAT_LITERAL,
    IMAGINARY_LITERAL,
    DURATION_LITERAL,
    STRING_LITERAL,
    IDENTIFIER,
    HARDWARE_QUBIT,   // $0, $1, ...

    // Program structure
    OPENQASM,
    INCLUDE,
    DEFCALGRAMMAR,

    // Calibration keywords
    CAL,
    DEFCAL,
    EXTERN,
    BARRIER,
    DELAY,

    // Control flow
    RETURN,
    FOR,
    IN,

    // Scalar types
    INT,
    UINT,
    FLOAT,
    ANGLE,
    BIT,
    BOOL,
    COMPLEX,
    DURATION,

    // Pulse-level types
    PORT,
    FRAME,
    WAVEFORM,

    TRUE,
    FALSE,

    // Punctuation
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    COMMA,
    SEMICOLON,
    COLON,
    ARROW,            // ->

    // Operators
    PLUS,
    MINUS,
    STAR,
    STAR_STAR,
    SLASH,
    PERCENT,
    TILDE,
    BANG,
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    AND,
    OR,
    BIT_AND,
    BIT_OR,
    BIT_XOR,
    LEFT_SHIFT,
    RIGHT_SHIFT,

    // Assignment
    ASSIGN,
    PLUS_ASSIGN,
    MINUS_ASSIGN,
    STAR_ASSIGN,
    SLASH_ASSIGN,

    EOF
}
