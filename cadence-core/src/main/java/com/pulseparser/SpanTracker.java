package com.pulseparser;

import com.pulseparser.ast.Span;

/**
 * Builds the {@link Span} attached to a node from the tokens consumed while the node
 * was recognized. The span runs from the first character of the first token to the
 * last character of the last token, so it covers the literal source text of the
 * construct including any whitespace or comments between its tokens.
 */
final class SpanTracker {
    private final String source;
    private final int[] lineOffsets;

    SpanTracker(String source) {
        this.source = source;
        this.lineOffsets = buildLineOffsetIndex(source);
    }

    Span between(Token first, Token last) {
        if (last.endPosition() < first.position()) {
            // A rule that consumed nothing; anchor an empty span at the first token
            return new Span(first.position(), first.position(), first.line(), first.column(), first.line(), first.column());
        }
        return new Span(first.position(), last.endPosition(), first.line(), first.column(), last.endLine(), last.endColumn());
    }

    Span of(Token token) {
        return between(token, token);
    }

    /**
     * Span of the whole source text, used for the program root.
     */
    Span whole() {
        int[] end = positionOf(source.length());
        return new Span(0, source.length(), 1, 0, end[0], end[1]);
    }

    // Build line offset index once during construction (O(n) operation)
    private static int[] buildLineOffsetIndex(String source) {
        int length = source.length();
        int[] offsets = new int[16];
        int count = 0;
        offsets[count++] = 0; // Line 1 starts at offset 0

        for (int i = 0; i < length; i++) {
            char ch = source.charAt(i);
            if (ch == '\n' || (ch == '\r' && (i + 1 >= length || source.charAt(i + 1) != '\n'))) {
                if (count == offsets.length) {
                    offsets = java.util.Arrays.copyOf(offsets, count * 2);
                }
                offsets[count++] = i + 1;
            }
        }
        return java.util.Arrays.copyOf(offsets, count);
    }

    // Line and column for an offset (O(log n) operation)
    private int[] positionOf(int offset) {
        int low = 0;
        int high = lineOffsets.length - 1;
        int line = 1;

        while (low <= high) {
            int mid = (low + high) / 2;
            if (lineOffsets[mid] <= offset) {
                line = mid + 1; // Lines are 1-indexed
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return new int[] {line, offset - lineOffsets[line - 1]};
    }
}
