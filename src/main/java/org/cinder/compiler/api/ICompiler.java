package org.cinder.compiler.api;

import org.cinder.compiler.ir.IrProgram;

import java.nio.file.Path;

/**
 * Defines the public, clean interface for the cinder compiler front end.
 */
public interface ICompiler {

    /**
     * Reads the root file and everything it imports, and lowers it.
     *
     * @param rootPath The path of the root file; the configured extension replaces any existing one.
     * @return The lowered program.
     * @throws CompilationException if the root file cannot be read or any file has errors.
     */
    IrProgram compile(Path rootPath) throws CompilationException;

    /**
     * Compiles the root file and hands the result to {@code backend}. The backend is never invoked
     * if any error was found.
     *
     * @param rootPath The path of the root file.
     * @param backend The stage that receives the lowered program.
     * @return The lowered program.
     * @throws CompilationException if the root file cannot be read or any file has errors.
     */
    default IrProgram compile(Path rootPath, Backend backend) throws CompilationException {
        IrProgram program = compile(rootPath);
        backend.process(program);
        return program;
    }

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE).
     */
    void setVerbosity(int level);
}
