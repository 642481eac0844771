package org.cinder.compiler.ir;

import java.nio.file.Path;
import java.util.List;

/**
 * The lowered top level of one file.
 *
 * @param path The canonical path of the file.
 * @param statements The lowered top-level statements, in source order.
 * @param globalCount The number of global slots the file uses.
 */
public record IrModule(Path path, List<IrStmt> statements, int globalCount) {}
