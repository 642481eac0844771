package org.cinder.compiler.config;

import com.typesafe.config.Config;

/**
 * The typed view of the {@code cinder.compiler} configuration block.
 *
 * @param fileExtension The extension of source files, without the dot.
 * @param verbosity The {@link org.cinder.compiler.diagnostics.CompilerLogger} level.
 */
public record CompilerConfig(String fileExtension, int verbosity) {

    /** The configuration path all settings live under. */
    public static final String ROOT = "cinder.compiler";

    /**
     * Reads the {@code cinder.compiler} block.
     * @param config A resolved configuration that contains the block, e.g. from {@link ConfigLoader#load()}.
     * @return The typed settings.
     * @throws com.typesafe.config.ConfigException if a setting is missing or has the wrong type.
     */
    public static CompilerConfig fromConfig(Config config) {
        Config compiler = config.getConfig(ROOT);
        String extension = compiler.getString("file-extension");
        if (extension.startsWith(".")) {
            extension = extension.substring(1);
        }
        return new CompilerConfig(extension, compiler.getInt("verbosity"));
    }

    /**
     * @return The settings from the default configuration sources.
     */
    public static CompilerConfig defaults() {
        return fromConfig(ConfigLoader.load());
    }
}
