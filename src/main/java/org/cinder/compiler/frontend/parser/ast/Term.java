package org.cinder.compiler.frontend.parser.ast;

import org.cinder.compiler.api.SourceRange;

import java.util.List;

/**
 * The universal expression node. Every term carries the exact source range it was parsed from.
 * <p>
 * Components documented as "may be null" are slots the parser found empty; whether that is an
 * error is decided by whoever consumes the tree.
 */
public sealed interface Term permits Term.NumericLiteral, Term.StringLiteral, Term.IntegerType, Term.FloatType,
        Term.Identity, Term.Identifier, Term.MethodName, Term.FieldByName, Term.FieldByNumber, Term.TypeAnnotation,
        Term.UnaryOperation, Term.BinaryOperation, Term.Assignment, Term.Conjunction, Term.Disjunction,
        Term.Parenthesized, Term.Tuple, Term.FunctionCall, Term.TypeParameters, Term.ReturnType {

    /**
     * @return The source range covered by this term.
     */
    SourceRange position();

    /**
     * A numeric literal, kept as source text with digit separators removed.
     * @param position The source range.
     * @param value The literal text, e.g. {@code "3.5"} or {@code "1e+9"}.
     */
    record NumericLiteral(SourceRange position, String value) implements Term {}

    /**
     * A string literal made of plain text and embedded expressions.
     * @param position The source range, including the quotes.
     * @param components The components in source order.
     */
    record StringLiteral(SourceRange position, List<StringComponent> components) implements Term {}

    /**
     * The builtin {@code int} type.
     * @param position The source range of the keyword.
     */
    record IntegerType(SourceRange position) implements Term {}

    /**
     * The builtin {@code float} type.
     * @param position The source range of the keyword.
     */
    record FloatType(SourceRange position) implements Term {}

    /**
     * The wildcard {@code _}.
     * @param position The source range of the underscore.
     */
    record Identity(SourceRange position) implements Term {}

    /**
     * A plain name.
     * @param position The source range.
     * @param name The name.
     */
    record Identifier(SourceRange position, String name) implements Term {}

    /**
     * The synthetic method an operator stands for, e.g. {@code add} for {@code +}.
     * @param position The source range of the operator token.
     * @param name The method name.
     */
    record MethodName(SourceRange position, String name) implements Term {}

    /**
     * {@code left.name}.
     * @param position The source range.
     * @param left The accessed term.
     * @param name The field name.
     */
    record FieldByName(SourceRange position, Term left, String name) implements Term {}

    /**
     * {@code left.0}.
     * @param position The source range.
     * @param left The accessed term.
     * @param number The field number as written.
     */
    record FieldByNumber(SourceRange position, Term left, String number) implements Term {}

    /**
     * {@code left: type}.
     * @param position The source range.
     * @param left The annotated term.
     * @param colonPosition The source range of the colon.
     * @param type The annotation. May be null.
     */
    record TypeAnnotation(SourceRange position, Term left, SourceRange colonPosition, Term type) implements Term {}

    /**
     * A prefix operator applied to an operand.
     * @param position The source range.
     * @param operator The operator.
     * @param operand The operand. May be null.
     */
    record UnaryOperation(SourceRange position, MethodName operator, Term operand) implements Term {}

    /**
     * An infix operator applied to two operands.
     * @param position The source range.
     * @param left The left operand. May be null.
     * @param operator The operator.
     * @param right The right operand. May be null.
     */
    record BinaryOperation(SourceRange position, Term left, MethodName operator, Term right) implements Term {}

    /**
     * A plain or compound assignment.
     * @param position The source range.
     * @param left The assigned term. May be null.
     * @param operator The assignment operator.
     * @param right The assigned value. May be null.
     */
    record Assignment(SourceRange position, Term left, MethodName operator, Term right) implements Term {}

    /**
     * {@code a && b && ...} as one flat chain.
     * @param position The source range.
     * @param conditions The operands; entries may be null. Always one more than the operators.
     * @param operatorPositions The source range of every {@code &&}.
     */
    record Conjunction(SourceRange position, List<Term> conditions, List<SourceRange> operatorPositions) implements Term {}

    /**
     * {@code a || b || ...} as one flat chain.
     * @param position The source range.
     * @param conditions The operands; entries may be null. Always one more than the operators.
     * @param operatorPositions The source range of every {@code ||}.
     */
    record Disjunction(SourceRange position, List<Term> conditions, List<SourceRange> operatorPositions) implements Term {}

    /**
     * A single term in parentheses.
     * @param position The source range, including the parentheses.
     * @param inner The enclosed term.
     */
    record Parenthesized(SourceRange position, Term inner) implements Term {}

    /**
     * A parenthesized list that is not a single term, e.g. {@code ()} or {@code (a, b)}.
     * @param position The source range, including the parentheses.
     * @param elements The elements, including empty slots.
     */
    record Tuple(SourceRange position, List<ListElement> elements) implements Term {}

    /**
     * {@code function(arguments)}.
     * @param position The source range.
     * @param function The called term.
     * @param arguments The arguments, including empty slots.
     */
    record FunctionCall(SourceRange position, Term function, List<ListElement> arguments) implements Term {}

    /**
     * {@code left[parameters]}.
     * @param position The source range.
     * @param left The parameterized term.
     * @param parameters The type parameters, including empty slots.
     */
    record TypeParameters(SourceRange position, Term left, List<ListElement> parameters) implements Term {}

    /**
     * {@code arguments -> returnType}.
     * @param position The source range.
     * @param arrowPosition The source range of the arrow.
     * @param arguments The term before the arrow.
     * @param returnType The term after the arrow. May be null.
     */
    record ReturnType(SourceRange position, SourceRange arrowPosition, Term arguments, Term returnType) implements Term {}
}
