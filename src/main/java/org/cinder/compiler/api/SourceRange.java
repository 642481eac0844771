package org.cinder.compiler.api;

/**
 * A half-open range {@code [start, end)} of source text, attached to every token,
 * syntax node and diagnostic.
 *
 * @param start The first position covered by the range.
 * @param end The position just after the last character covered by the range.
 */
public record SourceRange(SourceIndex start, SourceIndex end) {

    /**
     * Creates a range covering {@code width} code points on a single line.
     * @param start The first position.
     * @param width The number of code points covered.
     * @return The new range.
     */
    public static SourceRange ofWidth(SourceIndex start, int width) {
        return new SourceRange(start, new SourceIndex(start.line(), start.column() + width));
    }

    /**
     * @return The zero-based line on which the range starts.
     */
    public int line() {
        return start.line();
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
