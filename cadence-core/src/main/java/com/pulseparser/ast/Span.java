package com.pulseparser.ast;

/**
 * Source range a node was parsed from.
 *
 * @param start       offset of the first character (inclusive)
 * @param end         offset after the last character (exclusive)
 * @param startLine   1-based line of {@code start}
 * @param startColumn 0-based column of {@code start}
 * @param endLine     1-based line of {@code end}
 * @param endColumn   0-based column of {@code end}
 */
public record Span(
    int start,
    int end,
    int startLine,
    int startColumn,
    int endLine,
    int endColumn
) {
    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    /**
     * Returns the exact slice of {@code source} covered by this span.
     */
    public String text(String source) {
        return source.substring(start, end);
    }

    public boolean contains(Span other) {
        return other != null && start <= other.start && other.end <= end;
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
