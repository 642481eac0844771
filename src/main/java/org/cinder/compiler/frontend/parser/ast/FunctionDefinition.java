package org.cinder.compiler.frontend.parser.ast;

import org.cinder.compiler.api.SourceRange;

import java.nio.file.Path;
import java.util.List;

/**
 * A single {@code func} definition. Several definitions may share a name and form an overload set.
 *
 * @param name The function name.
 * @param namePosition The source range of the name.
 * @param path The canonical path of the file that defines the function.
 * @param typeParameters The bracketed type parameters. Always null until generics are supported.
 * @param parameters The parameter list, or null if the definition has no parentheses.
 * @param returnType The return type after {@code ->}, or null if there is none.
 * @param body The statements of the function body.
 */
public record FunctionDefinition(
        String name,
        SourceRange namePosition,
        Path path,
        List<ListElement> typeParameters,
        List<ListElement> parameters,
        ReturnType returnType,
        List<Stmt> body
) {
    /**
     * The {@code -> type} part of a function header.
     * @param arrowPosition The source range of the arrow.
     * @param type The return type. May be null.
     */
    public record ReturnType(SourceRange arrowPosition, Term type) {}
}
