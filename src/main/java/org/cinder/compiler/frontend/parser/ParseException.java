package org.cinder.compiler.frontend.parser;

import org.cinder.compiler.api.CompilerErrorCode;
import org.cinder.compiler.api.SourceRange;

import java.util.List;

/**
 * Thrown by the lexer and the parser when the current file cannot be parsed any further.
 * It is caught at the file boundary and recorded as a diagnostic.
 */
public class ParseException extends RuntimeException {

    private final transient ParseError error;

    /**
     * @param code The error code.
     * @param message The error message.
     * @param positions The source ranges the error refers to.
     */
    public ParseException(CompilerErrorCode code, String message, List<SourceRange> positions) {
        super(message);
        this.error = new ParseError(code, message, positions);
    }

    /**
     * @param code The error code.
     * @param message The error message.
     * @param position The source range of the error.
     */
    public ParseException(CompilerErrorCode code, String message, SourceRange position) {
        this(code, message, List.of(position));
    }

    /**
     * @return The structured error.
     */
    public ParseError getError() {
        return error;
    }
}
