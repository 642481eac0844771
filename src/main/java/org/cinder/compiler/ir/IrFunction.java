package org.cinder.compiler.ir;

import java.util.List;

/**
 * A lowered function body.
 *
 * @param definitionIndex The index of the definition; also the value used in {@link IrExpr.Function}.
 * @param fileIndex The module index of the defining file.
 * @param name The function name.
 * @param parameterCount The number of parameters, which occupy local slots {@code 0..parameterCount-1}.
 * @param parameterTypes The declared type of each parameter by slot, or null for an untyped parameter.
 *                       Types that cannot be resolved yet are {@link IrExpr.UnresolvedType}.
 * @param returnType The type written after {@code ->}, or null if the function declares none.
 * @param localCount The total number of local slots, parameters included.
 * @param body The lowered statements.
 */
public record IrFunction(int definitionIndex, int fileIndex, String name, int parameterCount,
                         List<IrExpr> parameterTypes, IrExpr returnType, int localCount, List<IrStmt> body) {}
