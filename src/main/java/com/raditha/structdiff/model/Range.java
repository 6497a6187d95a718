package com.raditha.structdiff.model;

/**
 * Span of a node in its source, 1-based and inclusive at both ends.
 *
 * @param startLine   First line of the span
 * @param endLine     Last line of the span
 * @param startColumn Column of the first character on {@code startLine}
 * @param endColumn   Column of the last character on {@code endLine}
 */
public record Range(
        int startLine,
        int endLine,
        int startColumn,
        int endColumn) {

    public static Range from(com.github.javaparser.Range jpRange) {
        return new Range(
                jpRange.begin.line,
                jpRange.end.line,
                jpRange.begin.column,
                jpRange.end.column);
    }

    /**
     * Span from the start of this range to the end of {@code last}.
     */
    public Range through(Range last) {
        return new Range(startLine, last.endLine, startColumn, last.endColumn);
    }

    /**
     * Format as "L45-52", or "L45" for a single line.
     */
    public String toDisplayString() {
        return startLine == endLine ? "L" + startLine : "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
