package org.cinder.compiler.frontend.io;

import org.cinder.compiler.api.SourceIndex;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SourceCursor}: code-point iteration, position tracking and the line table.
 */
class SourceCursorTest {

    /**
     * Verifies that consuming a line break moves the position to the first column of the next line.
     */
    @Test
    @Tag("unit")
    void tracksLineAndColumn() {
        // Arrange
        SourceCursor cursor = new SourceCursor("ab\nc");

        // Act
        cursor.consume();
        cursor.consume();
        SourceIndex beforeBreak = cursor.peekIndex();
        cursor.consume();

        // Assert
        assertThat(beforeBreak).isEqualTo(new SourceIndex(0, 2));
        assertThat(cursor.peekIndex()).isEqualTo(new SourceIndex(1, 0));
        assertThat(cursor.peekChar()).isEqualTo('c');
    }

    /**
     * Verifies that a supplementary character counts as a single column.
     */
    @Test
    @Tag("unit")
    void countsCodePointsNotChars() {
        // Arrange
        SourceCursor cursor = new SourceCursor("𝑥y");

        // Act
        int first = cursor.peekChar();
        cursor.consume();

        // Assert
        assertThat(first).isEqualTo(0x1D465);
        assertThat(cursor.peekIndex()).isEqualTo(new SourceIndex(0, 1));
        assertThat(cursor.peekChar()).isEqualTo('y');
    }

    /**
     * Verifies that a conditional consume leaves a non-matching code point unread.
     */
    @Test
    @Tag("unit")
    void consumeIfOnlyConsumesAMatch() {
        SourceCursor cursor = new SourceCursor("=>");

        assertThat(cursor.consumeIf('>')).isFalse();
        assertThat(cursor.consumeIf('=')).isTrue();
        assertThat(cursor.consumeIf('>')).isTrue();
        assertThat(cursor.peekChar()).isEqualTo(SourceCursor.END_OF_INPUT);

        cursor.consume();
        assertThat(cursor.peekIndex()).isEqualTo(new SourceIndex(0, 2));
    }

    /**
     * Verifies that the line table excludes line breaks and includes a final line without one.
     */
    @Test
    @Tag("unit")
    void buildsLineTable() {
        // Arrange
        SourceCursor cursor = new SourceCursor("var x\n\nx = 1");

        // Act & Assert
        assertThat(cursor.lines()).containsExactly(
                new SourceCursor.LineSpan(0, 5),
                new SourceCursor.LineSpan(6, 6),
                new SourceCursor.LineSpan(7, 12));
    }

    /**
     * Verifies that line offsets count code points, like the columns of positions.
     */
    @Test
    @Tag("unit")
    void lineTableCountsCodePoints() {
        // Arrange
        SourceCursor cursor = new SourceCursor("a\uD83D\uDE00b\nc");

        // Act
        for (int i = 0; i < 4; i++) {
            cursor.consume();
        }

        // Assert
        assertThat(cursor.lines()).containsExactly(
                new SourceCursor.LineSpan(0, 3),
                new SourceCursor.LineSpan(4, 5));
        assertThat(cursor.peekIndex()).isEqualTo(new SourceIndex(1, 0));
    }
}
