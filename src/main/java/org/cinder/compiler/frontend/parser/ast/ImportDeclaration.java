package org.cinder.compiler.frontend.parser.ast;

import org.cinder.compiler.api.SourceRange;

/**
 * {@code import name} or {@code import name("path")}, before the target file is resolved.
 *
 * @param keywordPosition The source range of {@code import}.
 * @param name The name under which the imported file is visible.
 * @param namePosition The source range of the name.
 * @param explicitPath The path given in parentheses, or null if the path follows from the name.
 * @param pathPosition The source range of the path literal, or null if there is none.
 */
public record ImportDeclaration(
        SourceRange keywordPosition,
        String name,
        SourceRange namePosition,
        String explicitPath,
        SourceRange pathPosition
) {
    /**
     * @return The source range to blame when the import cannot be resolved.
     */
    public SourceRange blamePosition() {
        return pathPosition != null ? pathPosition : namePosition;
    }
}
