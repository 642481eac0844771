package org.cinder.compiler.api;

import org.cinder.compiler.ir.IrProgram;

/**
 * The stage after the front end: type checking, code generation or execution of a lowered program.
 */
@FunctionalInterface
public interface Backend {

    /**
     * Processes a program that the front end accepted without errors.
     * @param program The lowered program.
     */
    void process(IrProgram program);
}
