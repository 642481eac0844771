package org.cinder.compiler.api;

/**
 * A single point in a source file. Both coordinates are zero-based; the column
 * counts Unicode code points from the start of the line.
 *
 * @param line The zero-based line number.
 * @param column The zero-based column number.
 */
public record SourceIndex(int line, int column) implements Comparable<SourceIndex> {

    /** The first character of a file. */
    public static final SourceIndex ORIGIN = new SourceIndex(0, 0);

    @Override
    public int compareTo(SourceIndex other) {
        if (line != other.line) {
            return Integer.compare(line, other.line);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return (line + 1) + ":" + (column + 1);
    }
}
