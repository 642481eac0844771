package org.cinder.compiler.ir;

import java.util.List;

/**
 * A lowered statement.
 */
public sealed interface IrStmt permits IrStmt.Declare, IrStmt.Expr, IrStmt.While {
	/**
	 * Declares a fresh variable.
	 * @param variable The {@link IrExpr.LocalVariable} or {@link IrExpr.GlobalVariable} of the new slot.
	 */
	record Declare(IrExpr variable) implements IrStmt {}

	/**
	 * Evaluates an expression.
	 * @param expr The expression.
	 */
	record Expr(IrExpr expr) implements IrStmt {}

	/**
	 * @param condition The loop condition.
	 * @param body The loop body.
	 */
	record While(IrExpr condition, List<IrStmt> body) implements IrStmt {}
}
