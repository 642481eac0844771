package org.cinder.compiler.frontend.module;

import org.cinder.compiler.api.CompilationException;
import org.cinder.compiler.api.CompilerErrorCode;
import org.cinder.compiler.diagnostics.CompilerLogger;
import org.cinder.compiler.diagnostics.DiagnosticsEngine;
import org.cinder.compiler.frontend.io.SourceCursor;
import org.cinder.compiler.frontend.io.SourceLoader;
import org.cinder.compiler.frontend.lexer.Lexer;
import org.cinder.compiler.frontend.lexer.Token;
import org.cinder.compiler.frontend.lexer.TokenType;
import org.cinder.compiler.frontend.parser.ParseError;
import org.cinder.compiler.frontend.parser.ParseException;
import org.cinder.compiler.frontend.parser.Parser;
import org.cinder.compiler.frontend.parser.ast.FunctionDefinition;
import org.cinder.compiler.frontend.parser.ast.ImportDeclaration;
import org.cinder.compiler.frontend.parser.ast.Stmt;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a root file and, depth-first, every file it imports.
 * <p>
 * Canonical paths are the deduplication key. A path that is already fully read is a legal diamond
 * import and returns the cached module index without parsing again. A path that is still on the
 * active import chain is a circular import. Problems inside one file are recorded in the
 * {@link DiagnosticsEngine}; only a failure to read the root file stops the whole run.
 * <p>
 * A loader reads exactly one program and is not reusable.
 */
public class ModuleLoader {

    private final DiagnosticsEngine diagnostics;
    private final String fileExtension;

    private final List<FileRecord> files = new ArrayList<>();
    private final List<Map<String, Item>> items = new ArrayList<>();
    private final List<FunctionDefinition> functions = new ArrayList<>();
    private final Map<Path, Integer> fileIndices = new HashMap<>();
    private final Set<Path> importChain = new HashSet<>();

    /**
     * @param diagnostics The engine collecting every error of the run.
     * @param fileExtension The extension given to the root path and every import path, without the dot.
     */
    public ModuleLoader(DiagnosticsEngine diagnostics, String fileExtension) {
        this.diagnostics = diagnostics;
        this.fileExtension = fileExtension;
    }

    /**
     * Reads the root file and all files it transitively imports.
     *
     * @param rootPath The root file; its extension is replaced by the configured one.
     * @return The tables of everything read. Errors inside the files are in the diagnostics engine.
     * @throws CompilationException if the root file cannot be found or read.
     */
    public ModuleTable load(Path rootPath) throws CompilationException {
        Path withExtension = SourceLoader.withExtension(rootPath, fileExtension);
        Path canonical;
        try {
            canonical = SourceLoader.canonicalize(withExtension);
        } catch (IOException e) {
            throw rootFailure(CompilerErrorCode.ROOT_FILE_NOT_FOUND,
                    "Root file not found: " + withExtension, withExtension, e);
        }

        importChain.add(canonical);
        int rootIndex;
        try {
            rootIndex = readFile(canonical);
        } catch (IOException e) {
            throw rootFailure(CompilerErrorCode.CANNOT_READ_ROOT_FILE,
                    "Cannot read root file: " + canonical, canonical, e);
        } finally {
            importChain.remove(canonical);
        }
        return new ModuleTable(files, items, functions, fileIndices, rootIndex);
    }

    private CompilationException rootFailure(CompilerErrorCode code, String message, Path path, IOException cause) {
        diagnostics.reportError(code, message + " (" + cause.getMessage() + ")", path.toString(), List.of());
        CompilationException exception = new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        exception.initCause(cause);
        return exception;
    }

    /**
     * Returns the module index of {@code path}, reading and parsing the file first if it has not
     * been read yet. The caller has already put the path on the import chain.
     */
    private int readFile(Path path) throws IOException {
        Integer known = fileIndices.get(path);
        if (known != null) {
            CompilerLogger.debug("Diamond import of {} reuses module {}", path, known);
            return known;
        }

        String content = SourceLoader.loadFile(path).content();
        SourceCursor cursor = new SourceCursor(content);
        List<Stmt> statements = new ArrayList<>();
        Map<String, Item> fileItems = new LinkedHashMap<>();
        try {
            parseFile(cursor, path, statements, fileItems);
        } catch (ParseException e) {
            ParseError error = e.getError();
            diagnostics.reportError(error.code(), error.message(), path.toString(), error.positions());
            statements.clear();
            fileItems.clear();
        }

        int index = files.size();
        files.add(new FileRecord(path, content, cursor.lines(), statements));
        items.add(fileItems);
        fileIndices.put(path, index);
        CompilerLogger.debug("Read {} as module {}", path, index);
        return index;
    }

    private void parseFile(SourceCursor cursor, Path path, List<Stmt> statements, Map<String, Item> fileItems) {
        Parser parser = new Parser(new Lexer(cursor));
        while (parser.hasRemainingToken()) {
            Token token = parser.nextToken();
            if (token.is(TokenType.KEYWORD_IMPORT)) {
                resolveImport(parser.parseImportDeclaration(), path, fileItems);
            } else if (token.is(TokenType.KEYWORD_FUNC)) {
                addFunction(parser.parseFunctionDefinition(path), path, fileItems);
            } else {
                Stmt statement = parser.parseStmt(new ArrayList<>());
                if (statement == null) {
                    throw new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN,
                            "Unexpected " + token.describe(), parser.nextTokenPosition());
                }
                statements.add(statement);
            }
        }
    }

    /**
     * Reads the target of an import and binds it in the importing file. Failures are recorded
     * against the importing file, which keeps parsing.
     */
    private void resolveImport(ImportDeclaration declaration, Path importer, Map<String, Item> fileItems) {
        String fileName = importer.toString();
        if (fileItems.containsKey(declaration.name())) {
            diagnostics.reportError(CompilerErrorCode.DUPLICATE_DEFINITION,
                    "'" + declaration.name() + "' is already defined in this file", fileName, declaration.namePosition());
            return;
        }

        String relative = declaration.explicitPath() != null ? declaration.explicitPath() : declaration.name();
        Path target = SourceLoader.withExtension(importer.getParent().resolve(relative), fileExtension);
        Path canonical;
        try {
            canonical = SourceLoader.canonicalize(target);
        } catch (IOException e) {
            diagnostics.reportError(CompilerErrorCode.CANNOT_READ_IMPORTED_FILE,
                    "Cannot read imported file " + target + " (" + e.getMessage() + ")",
                    fileName, declaration.blamePosition());
            return;
        }

        if (!importChain.add(canonical)) {
            diagnostics.reportError(CompilerErrorCode.CIRCULAR_IMPORT,
                    "Circular import of " + canonical, fileName, declaration.blamePosition());
            return;
        }
        try {
            int index = readFile(canonical);
            fileItems.put(declaration.name(), new Item.Import(index));
        } catch (IOException e) {
            diagnostics.reportError(CompilerErrorCode.CANNOT_READ_IMPORTED_FILE,
                    "Cannot read imported file " + canonical + " (" + e.getMessage() + ")",
                    fileName, declaration.blamePosition());
        } finally {
            importChain.remove(canonical);
        }
    }

    private void addFunction(FunctionDefinition definition, Path path, Map<String, Item> fileItems) {
        Item existing = fileItems.get(definition.name());
        List<Integer> overloads = new ArrayList<>();
        if (existing instanceof Item.Function function) {
            overloads.addAll(function.definitions());
        } else if (existing != null) {
            diagnostics.reportError(CompilerErrorCode.DUPLICATE_DEFINITION,
                    "'" + definition.name() + "' is already defined in this file and is not a function",
                    path.toString(), definition.namePosition());
            return;
        }
        overloads.add(functions.size());
        functions.add(definition);
        fileItems.put(definition.name(), new Item.Function(overloads));
    }
}
