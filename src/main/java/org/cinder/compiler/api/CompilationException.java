package org.cinder.compiler.api;

import org.cinder.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 * All diagnostics collected up to the failure travel with it.
 */
public class CompilationException extends Exception {

    private final transient List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        this(message, List.of());
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.of();
    }

    /**
     * Constructs a new compilation exception carrying the collected diagnostics.
     * @param message The detail message, usually the rendered diagnostics.
     * @param diagnostics The diagnostics that caused the failure.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics that caused the failure; empty if none were collected.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
