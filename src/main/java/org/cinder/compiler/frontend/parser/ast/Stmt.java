package org.cinder.compiler.frontend.parser.ast;

import org.cinder.compiler.api.SourceRange;

import java.util.List;

/**
 * A statement inside a file or a block.
 */
public sealed interface Stmt permits Stmt.Var, Stmt.Expression, Stmt.While {

    /**
     * {@code var name}: introduces a fresh binding.
     * @param keywordPosition The source range of {@code var}.
     * @param name The declared variable.
     */
    record Var(SourceRange keywordPosition, Term.Identifier name) implements Stmt {}

    /**
     * A bare expression.
     * @param term The expression.
     */
    record Expression(Term term) implements Stmt {}

    /**
     * {@code while condition ... end}.
     * @param keywordPosition The source range of {@code while}.
     * @param condition The loop condition.
     * @param body The statements of the loop body.
     */
    record While(SourceRange keywordPosition, Term condition, List<Stmt> body) implements Stmt {}
}
