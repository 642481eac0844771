package org.cinder.compiler.ir;

import java.util.List;

/**
 * The lowered program handed to a backend. Modules are indexed by module index and functions by
 * definition index.
 *
 * @param modules One entry per file.
 * @param functions One entry per function definition.
 * @param rootIndex The module index of the root file.
 */
public record IrProgram(List<IrModule> modules, List<IrFunction> functions, int rootIndex) {}
