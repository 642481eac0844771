package org.cinder.compiler.frontend.parser.ast;

import org.cinder.compiler.api.SourceRange;

/**
 * A piece of a string literal.
 */
public sealed interface StringComponent permits StringComponent.Text, StringComponent.Interpolation {

    /**
     * Literal text with escapes and doubled braces already resolved.
     * @param text The text.
     */
    record Text(String text) implements StringComponent {}

    /**
     * An embedded {@code {expression}}.
     * @param bracePosition The source range of the opening brace.
     * @param term The embedded expression. May be null for {@code {}}.
     */
    record Interpolation(SourceRange bracePosition, Term term) implements StringComponent {}
}
