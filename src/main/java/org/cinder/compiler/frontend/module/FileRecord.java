package org.cinder.compiler.frontend.module;

import org.cinder.compiler.frontend.io.SourceCursor;
import org.cinder.compiler.frontend.parser.ast.Stmt;

import java.nio.file.Path;
import java.util.List;

/**
 * A source file that has been read. Its position in {@link ModuleTable#files()} is the module index
 * every cross-file reference uses.
 *
 * @param path The canonical path of the file.
 * @param content The raw source text.
 * @param lines The line-offset table, used to render diagnostics against the text.
 * @param statements The top-level statements; empty if the file failed to parse.
 */
public record FileRecord(Path path, String content, List<SourceCursor.LineSpan> lines, List<Stmt> statements) {
    public FileRecord {
        lines = List.copyOf(lines);
        statements = List.copyOf(statements);
    }
}
