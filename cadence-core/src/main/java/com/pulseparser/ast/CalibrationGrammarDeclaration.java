package com.pulseparser.ast;

/**
 * {@code defcalgrammar "openpulse";} selects the grammar used by calibration bodies.
 */
public record CalibrationGrammarDeclaration(
    Span span,
    String name
) implements Statement {
    public CalibrationGrammarDeclaration(String name) {
        this(null, name);
    }

    @Override
    public String kind() {
        return "CalibrationGrammarDeclaration";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
