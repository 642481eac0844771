package org.cinder.compiler.frontend.io;

import org.cinder.compiler.api.SourceIndex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A position-tracked iterator over the code points of a source text.
 * The lexer reads through it one code point at a time and asks it for
 * the position of the next unread character.
 */
public class SourceCursor {

    /** Returned by {@link #peekChar()} once the whole text has been consumed. */
    public static final int END_OF_INPUT = -1;

    /**
     * The code point offsets of a single line, in the unit of {@link SourceIndex#column()}.
     *
     * @param start The offset of the first code point of the line.
     * @param end The offset just after the last code point, excluding the line break.
     */
    public record LineSpan(int start, int end) {}

    private final String text;
    private final List<LineSpan> lines;
    private int offset = 0;
    private int line = 0;
    private int column = 0;

    /**
     * Creates a cursor positioned at the first character of {@code text}.
     * @param text The full source text.
     */
    public SourceCursor(String text) {
        this.text = text;
        this.lines = Collections.unmodifiableList(computeLines(text));
    }

    /**
     * @return The next code point, or {@link #END_OF_INPUT} at the end of the text.
     */
    public int peekChar() {
        if (offset >= text.length()) return END_OF_INPUT;
        return text.codePointAt(offset);
    }

    /**
     * @return The position of the next unread code point.
     */
    public SourceIndex peekIndex() {
        return new SourceIndex(line, column);
    }

    /**
     * Consumes the next code point. Does nothing at the end of the text.
     */
    public void consume() {
        if (offset >= text.length()) return;
        int ch = text.codePointAt(offset);
        offset += Character.charCount(ch);
        if (ch == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
    }

    /**
     * Consumes the next code point if it equals {@code expected}.
     * @param expected The code point to match.
     * @return true if the code point matched and was consumed.
     */
    public boolean consumeIf(int expected) {
        if (peekChar() == expected) {
            consume();
            return true;
        }
        return false;
    }

    /**
     * @return The line-offset table of the whole text, one entry per line.
     */
    public List<LineSpan> lines() {
        return lines;
    }

    private static List<LineSpan> computeLines(String text) {
        List<LineSpan> result = new ArrayList<>();
        int start = 0;
        int codePoints = 0;
        for (int i = 0; i < text.length(); i += Character.charCount(text.codePointAt(i))) {
            if (text.charAt(i) == '\n') {
                result.add(new LineSpan(start, codePoints));
                start = codePoints + 1;
            }
            codePoints++;
        }
        result.add(new LineSpan(start, codePoints));
        return result;
    }
}
