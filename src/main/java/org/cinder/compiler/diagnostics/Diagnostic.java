package org.cinder.compiler.diagnostics;

import org.cinder.compiler.api.CompilerErrorCode;
import org.cinder.compiler.api.SourceRange;

import java.util.List;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs during the compilation process.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The machine-readable error code.
 * @param message The diagnostic message.
 * @param fileName The canonical path of the file where the issue occurred.
 * @param positions The source ranges the message refers to, most relevant first. May be empty.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        String fileName,
        List<SourceRange> positions
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    public Diagnostic {
        positions = List.copyOf(positions);
    }

    /**
     * @return The one-based line number of the first position, or 0 if the diagnostic has no position.
     */
    public int lineNumber() {
        return positions.isEmpty() ? 0 : positions.get(0).line() + 1;
    }

    @Override
    public String toString() {
        String where = positions.isEmpty() ? "" : ":" + positions.get(0).start();
        return String.format("[%s] %s%s: %s (%s)", type, fileName, where, message, code);
    }
}
