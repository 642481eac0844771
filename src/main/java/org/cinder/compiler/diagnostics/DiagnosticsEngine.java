package org.cinder.compiler.diagnostics;

import org.cinder.compiler.api.CompilerErrorCode;
import org.cinder.compiler.api.SourceRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during the compilation process.
 * <p>
 * This decouples error reporting from the actual compiler logic (parser, etc.).
 * The number of reported errors is the counter that decides whether the backend runs.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code      The error code.
     * @param message   The error message.
     * @param fileName  The file in which the error occurred.
     * @param positions The source ranges the error refers to.
     */
    public void reportError(CompilerErrorCode code, String message, String fileName, List<SourceRange> positions) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, fileName, positions));
    }

    /**
     * Reports an error at a single position.
     *
     * @param code     The error code.
     * @param message  The error message.
     * @param fileName The file in which the error occurred.
     * @param position The source range of the error.
     */
    public void reportError(CompilerErrorCode code, String message, String fileName, SourceRange position) {
        reportError(code, message, fileName, List.of(position));
    }

    /**
     * Reports a warning.
     *
     * @param code      The code describing the condition.
     * @param message   The warning message.
     * @param fileName  The file in which the warning occurred.
     * @param positions The source ranges the warning refers to.
     */
    public void reportWarning(CompilerErrorCode code, String message, String fileName, List<SourceRange> positions) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, fileName, positions));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return errorCount() > 0;
    }

    /**
     * @return The number of errors reported so far.
     */
    public int errorCount() {
        return (int) diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
