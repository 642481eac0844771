package org.cinder.compiler.frontend.module;

import org.cinder.compiler.frontend.parser.ast.FunctionDefinition;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything the {@link ModuleLoader} read: the file table, one namespace per file and the flat table
 * of function definitions. All tables are index-addressed and read-only.
 *
 * @param files The files in the order their parsing completed; imported files come before their importers.
 * @param items The namespace of each file, aligned with {@code files}.
 * @param functions Every function definition of every file.
 * @param fileIndices The module index of each canonical path.
 * @param rootIndex The module index of the root file.
 */
public record ModuleTable(
        List<FileRecord> files,
        List<Map<String, Item>> items,
        List<FunctionDefinition> functions,
        Map<Path, Integer> fileIndices,
        int rootIndex
) {
    public ModuleTable {
        files = List.copyOf(files);
        items = items.stream().map(Map::copyOf).toList();
        functions = List.copyOf(functions);
        fileIndices = Map.copyOf(fileIndices);
    }

    /**
     * @param path The canonical path of a file.
     * @return The module index of the file.
     * @throws IllegalArgumentException if the file was not read.
     */
    public int fileIndexOf(Path path) {
        Integer index = fileIndices.get(path);
        if (index == null) {
            throw new IllegalArgumentException("File was not read: " + path);
        }
        return index;
    }
}
