package org.cinder.compiler.frontend.lexer;

import org.cinder.compiler.frontend.parser.ast.StringComponent;

import java.util.List;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The name of an identifier, the digits of a numeric literal (separators removed),
 *             or the fixed symbol of any other token. Empty for string literals.
 * @param components The components of a string literal; empty for every other token.
 * @param adjacent Whether no whitespace or comment separates this token from the previous one.
 * @param onNewLine Whether a line break separates this token from the previous one.
 */
public record Token(
        TokenType type,
        String text,
        List<StringComponent> components,
        boolean adjacent,
        boolean onNewLine
) {
    /**
     * Checks the type of this token.
     * @param expected The type to compare against.
     * @return true if the token has the given type.
     */
    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * @return A short description of the token for error messages.
     */
    public String describe() {
        return switch (type) {
            case STRING_LITERAL -> "string literal";
            case DIGITS -> "numeric literal '" + text + "'";
            case IDENTIFIER -> "identifier '" + text + "'";
            default -> "'" + text + "'";
        };
    }
}
