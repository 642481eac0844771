package org.cinder.compiler;

import org.cinder.compiler.api.CompilationException;
import org.cinder.compiler.api.ICompiler;
import org.cinder.compiler.config.CompilerConfig;
import org.cinder.compiler.diagnostics.CompilerLogger;
import org.cinder.compiler.diagnostics.DiagnosticsEngine;
import org.cinder.compiler.frontend.module.ModuleLoader;
import org.cinder.compiler.frontend.module.ModuleTable;
import org.cinder.compiler.frontend.semantics.NameResolver;
import org.cinder.compiler.ir.IrProgram;

import java.nio.file.Path;

/**
 * The main compiler implementation. This class orchestrates the front end from the root
 * file to the lowered program. It is not thread-safe.
 * <p>
 * Phases: reading and parsing all files, then name resolution. Each phase runs to completion
 * and collects every error it can find; a nonzero error count stops the run before the next phase.
 */
public class Compiler implements ICompiler {

    private final CompilerConfig config;
    private int verbosity = -1;

    /**
     * Creates a compiler with the settings from {@link org.cinder.compiler.config.ConfigLoader}.
     */
    public Compiler() {
        this(CompilerConfig.defaults());
    }

    /**
     * @param config The settings to compile with.
     */
    public Compiler(CompilerConfig config) {
        this.config = config;
    }

    @Override
    public IrProgram compile(Path rootPath) throws CompilationException {
        CompilerLogger.setLevel(verbosity >= 0 ? verbosity : config.verbosity());
        CompilerLogger.info("Compiling {}", rootPath);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Reading and parsing the root file and its imports
        ModuleTable modules;
        try {
            modules = new ModuleLoader(diagnostics, config.fileExtension()).load(rootPath);
        } catch (CompilationException e) {
            CompilerLogger.error("Compilation of {} failed: {}", rootPath, e.getMessage());
            throw e;
        }
        abortOnErrors(rootPath, diagnostics);

        // Phase 2: Name resolution and lowering
        IrProgram program = new NameResolver(modules, diagnostics).resolve();
        abortOnErrors(rootPath, diagnostics);

        CompilerLogger.info("Compiled {}: {} file(s), {} function(s)",
                rootPath, program.modules().size(), program.functions().size());
        return program;
    }

    private static void abortOnErrors(Path rootPath, DiagnosticsEngine diagnostics) throws CompilationException {
        if (diagnostics.hasErrors()) {
            CompilerLogger.error("Compilation of {} failed with {} error(s)", rootPath, diagnostics.errorCount());
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }
}
