package org.cinder.compiler.frontend.parser.ast;

import org.cinder.compiler.api.SourceRange;

/**
 * One slot of a comma-separated list. Empty slots keep the position of the comma that closed them
 * so that a missing expression can be reported exactly.
 */
public sealed interface ListElement permits ListElement.NonEmpty, ListElement.Empty {

    /**
     * A slot holding a term.
     * @param term The term.
     */
    record NonEmpty(Term term) implements ListElement {}

    /**
     * A slot with nothing before its comma, as in {@code f(a, , b)}.
     * @param commaPosition The source range of the comma.
     */
    record Empty(SourceRange commaPosition) implements ListElement {}
}
