package org.cinder.compiler.frontend.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Centralizes file access for the compiler: extension handling, canonicalization
 * and reading source text. File handles never outlive a single call.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content The raw file content.
     * @param path    The canonical path, used for deduplication and diagnostics.
     */
    public record LoadResult(String content, Path path) {}

    private SourceLoader() {}

    /**
     * Replaces the extension of the last path component with {@code extension},
     * or appends it if the component has none.
     *
     * @param path      The path to adjust.
     * @param extension The extension without the leading dot.
     * @return The adjusted path.
     */
    public static Path withExtension(Path path, String extension) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return path;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return path.resolveSibling(stem + "." + extension);
    }

    /**
     * Resolves {@code path} to its absolute, symlink-free form.
     *
     * @param path The path to canonicalize.
     * @return The canonical path.
     * @throws IOException If the file does not exist or cannot be resolved.
     */
    public static Path canonicalize(Path path) throws IOException {
        return path.toAbsolutePath().toRealPath();
    }

    /**
     * Loads content from a canonical filesystem path as UTF-8 text.
     *
     * @param canonicalPath The canonical path of the file.
     * @return The loaded content and its path.
     * @throws IOException If the file cannot be read or is not valid UTF-8.
     */
    public static LoadResult loadFile(Path canonicalPath) throws IOException {
        String content = Files.readString(canonicalPath, StandardCharsets.UTF_8);
        return new LoadResult(content, canonicalPath);
    }
}
