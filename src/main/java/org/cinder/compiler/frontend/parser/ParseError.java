package org.cinder.compiler.frontend.parser;

import org.cinder.compiler.api.CompilerErrorCode;
import org.cinder.compiler.api.SourceRange;

import java.util.List;

/**
 * A lexical or syntax error found while parsing one file.
 *
 * @param code The error code.
 * @param message A message naming the offending or expected construct.
 * @param positions The source ranges the error refers to: the offending token, an anchor such as the
 *                  opening delimiter, or the whole stack of open blocks or comments.
 */
public record ParseError(CompilerErrorCode code, String message, List<SourceRange> positions) {
    public ParseError {
        positions = List.copyOf(positions);
    }
}
