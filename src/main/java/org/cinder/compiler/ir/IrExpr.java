package org.cinder.compiler.ir;

import java.util.List;

/**
 * A lowered expression. Names are gone: every variable is a slot, every function an overload set
 * of definition indices and every imported file a module index.
 */
public sealed interface IrExpr permits IrExpr.LocalVariable, IrExpr.GlobalVariable, IrExpr.Function, IrExpr.Module,
		IrExpr.UnresolvedType, IrExpr.NumericLiteral, IrExpr.StringLiteral, IrExpr.Operator, IrExpr.Assign,
		IrExpr.And, IrExpr.Or, IrExpr.Tuple, IrExpr.FieldByName, IrExpr.FieldByNumber, IrExpr.Call,
		IrExpr.TypeApplication, IrExpr.TypeAnnotation, IrExpr.ReturnType, IrExpr.Identity, IrExpr.Invalid {

	/**
	 * A variable of the enclosing function.
	 * @param slot The local slot.
	 */
	record LocalVariable(int slot) implements IrExpr {}

	/**
	 * A top-level variable of a file.
	 * @param fileIndex The module index of the file that declares the variable.
	 * @param slot The global slot within that file.
	 */
	record GlobalVariable(int fileIndex, int slot) implements IrExpr {}

	/**
	 * An overload set.
	 * @param definitions The indices of the candidate definitions.
	 */
	record Function(List<Integer> definitions) implements IrExpr {}

	/**
	 * An imported file.
	 * @param fileIndex The module index.
	 */
	record Module(int fileIndex) implements IrExpr {}

	/**
	 * A type the front end does not resolve; the marker where a type system will plug in.
	 * @param name The builtin keyword or declared name of the type.
	 */
	record UnresolvedType(String name) implements IrExpr {}

	/**
	 * @param value The literal text.
	 */
	record NumericLiteral(String value) implements IrExpr {}

	/**
	 * @param parts The text and embedded expressions, in source order.
	 */
	record StringLiteral(List<StringPart> parts) implements IrExpr {}

	/**
	 * A piece of a lowered string literal.
	 */
	sealed interface StringPart permits Text, Embedded {}

	/**
	 * @param text Literal text.
	 */
	record Text(String text) implements StringPart {}

	/**
	 * @param expr An embedded expression.
	 */
	record Embedded(IrExpr expr) implements StringPart {}

	/**
	 * A prefix or infix operator, as a call of its named method.
	 * @param method The method name, e.g. {@code add}.
	 * @param operands One operand for prefix operators, two for infix operators.
	 */
	record Operator(String method, List<IrExpr> operands) implements IrExpr {}

	/**
	 * @param method The assignment method, e.g. {@code assign} or {@code add_assign}.
	 * @param target The assigned expression.
	 * @param value The assigned value.
	 */
	record Assign(String method, IrExpr target, IrExpr value) implements IrExpr {}

	/**
	 * @param conditions The operands of a {@code &&} chain.
	 */
	record And(List<IrExpr> conditions) implements IrExpr {}

	/**
	 * @param conditions The operands of a {@code ||} chain.
	 */
	record Or(List<IrExpr> conditions) implements IrExpr {}

	/**
	 * @param elements The elements.
	 */
	record Tuple(List<IrExpr> elements) implements IrExpr {}

	/**
	 * @param target The accessed expression.
	 * @param name The field name.
	 */
	record FieldByName(IrExpr target, String name) implements IrExpr {}

	/**
	 * @param target The accessed expression.
	 * @param number The field number as written.
	 */
	record FieldByNumber(IrExpr target, String number) implements IrExpr {}

	/**
	 * @param function The called expression.
	 * @param arguments The arguments.
	 */
	record Call(IrExpr function, List<IrExpr> arguments) implements IrExpr {}

	/**
	 * @param target The parameterized expression.
	 * @param parameters The type parameters.
	 */
	record TypeApplication(IrExpr target, List<IrExpr> parameters) implements IrExpr {}

	/**
	 * @param value The annotated expression.
	 * @param type The annotation.
	 */
	record TypeAnnotation(IrExpr value, IrExpr type) implements IrExpr {}

	/**
	 * @param arguments The expression before the arrow.
	 * @param returnType The expression after the arrow.
	 */
	record ReturnType(IrExpr arguments, IrExpr returnType) implements IrExpr {}

	/**
	 * The wildcard {@code _}.
	 */
	record Identity() implements IrExpr {}

	/**
	 * Stands in for an expression that could not be lowered. Only produced alongside a reported error.
	 */
	record Invalid() implements IrExpr {}
}
