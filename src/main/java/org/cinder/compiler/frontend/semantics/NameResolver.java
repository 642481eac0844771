package org.cinder.compiler.frontend.semantics;

import org.cinder.compiler.api.CompilerErrorCode;
import org.cinder.compiler.api.SourceRange;
import org.cinder.compiler.diagnostics.CompilerLogger;
import org.cinder.compiler.diagnostics.DiagnosticsEngine;
import org.cinder.compiler.frontend.module.FileRecord;
import org.cinder.compiler.frontend.module.Item;
import org.cinder.compiler.frontend.module.ModuleTable;
import org.cinder.compiler.frontend.parser.ast.FunctionDefinition;
import org.cinder.compiler.frontend.parser.ast.ListElement;
import org.cinder.compiler.frontend.parser.ast.Stmt;
import org.cinder.compiler.frontend.parser.ast.StringComponent;
import org.cinder.compiler.frontend.parser.ast.Term;
import org.cinder.compiler.ir.IrExpr;
import org.cinder.compiler.ir.IrFunction;
import org.cinder.compiler.ir.IrModule;
import org.cinder.compiler.ir.IrProgram;
import org.cinder.compiler.ir.IrStmt;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns slots to variables and lowers the parsed files into the {@link IrProgram}.
 * <p>
 * The top level of every file is lowered first, with its own counter of global slots. The
 * variables still bound at the end of a file become {@link Item.GlobalVariable} entries of its
 * namespace, which makes them visible to the function bodies lowered afterwards.
 * <p>
 * An identifier resolves to the innermost variable binding, then to the item of the same name in
 * the owning file. Every failure is reported to the {@link DiagnosticsEngine} and lowered to
 * {@link IrExpr.Invalid}, so one run reports every undefined name. The result must not be used
 * if errors were reported.
 */
public class NameResolver {

    private final ModuleTable modules;
    private final DiagnosticsEngine diagnostics;
    private final List<Map<String, Item>> namespaces = new ArrayList<>();

    private int fileIndex;
    private String fileName;
    private SlotScope scope;
    private boolean topLevel;

    /**
     * @param modules The files and definitions to lower.
     * @param diagnostics The engine receiving every resolution error.
     */
    public NameResolver(ModuleTable modules, DiagnosticsEngine diagnostics) {
        this.modules = modules;
        this.diagnostics = diagnostics;
    }

    /**
     * Lowers every file, then every function definition.
     * @return The lowered program.
     */
    public IrProgram resolve() {
        namespaces.clear();
        for (Map<String, Item> items : modules.items()) {
            namespaces.add(new HashMap<>(items));
        }

        List<IrModule> irModules = new ArrayList<>();
        for (int i = 0; i < modules.files().size(); i++) {
            irModules.add(resolveModule(i));
        }
        List<IrFunction> irFunctions = new ArrayList<>();
        for (int i = 0; i < modules.functions().size(); i++) {
            irFunctions.add(resolveFunction(i));
        }
        return new IrProgram(List.copyOf(irModules), List.copyOf(irFunctions), modules.rootIndex());
    }

    private void begin(int index, Path path, boolean isTopLevel) {
        this.fileIndex = index;
        this.fileName = path.toString();
        this.scope = new SlotScope();
        this.topLevel = isTopLevel;
    }

    private IrModule resolveModule(int index) {
        FileRecord file = modules.files().get(index);
        begin(index, file.path(), true);
        List<IrStmt> statements = lowerStatements(file.statements());
        Map<String, Item> namespace = namespaces.get(index);
        scope.bindings().forEach((name, slot) -> namespace.put(name, new Item.GlobalVariable(slot)));
        CompilerLogger.trace("Lowered top level of {} with {} global slot(s)", file.path(), scope.slotCount());
        return new IrModule(file.path(), List.copyOf(statements), scope.slotCount());
    }

    private IrFunction resolveFunction(int definitionIndex) {
        FunctionDefinition definition = modules.functions().get(definitionIndex);
        begin(modules.fileIndexOf(definition.path()), definition.path(), false);

        List<IrExpr> parameterTypes = new ArrayList<>();
        if (definition.parameters() != null) {
            for (ListElement parameter : definition.parameters()) {
                declareParameter(parameter, parameterTypes);
            }
        }
        int parameterCount = scope.slotCount();
        IrExpr returnType = null;
        if (definition.returnType() != null) {
            returnType = required(definition.returnType().type(), definition.returnType().arrowPosition(),
                    CompilerErrorCode.MISSING_EXPRESSION, "Expected a return type after '->'");
        }

        List<IrStmt> body = lowerStatements(definition.body());
        CompilerLogger.trace("Lowered function {} with {} local slot(s)", definition.name(), scope.slotCount());
        return new IrFunction(definitionIndex, fileIndex, definition.name(), parameterCount,
                Collections.unmodifiableList(parameterTypes), returnType, scope.slotCount(), List.copyOf(body));
    }

    /**
     * Declares {@code x} or {@code x: T} as the next local slot and records its type, null for {@code x}.
     * The type is lowered before the name is bound.
     */
    private void declareParameter(ListElement parameter, List<IrExpr> parameterTypes) {
        if (parameter instanceof ListElement.Empty empty) {
            diagnostics.reportError(CompilerErrorCode.MISSING_EXPRESSION,
                    "Expected a parameter before ','", fileName, empty.commaPosition());
            return;
        }
        Term term = ((ListElement.NonEmpty) parameter).term();
        if (term instanceof Term.Identifier identifier) {
            scope.declare(identifier.name());
            parameterTypes.add(null);
        } else if (term instanceof Term.TypeAnnotation annotation
                && annotation.left() instanceof Term.Identifier annotated) {
            IrExpr type = required(annotation.type(), annotation.colonPosition(),
                    CompilerErrorCode.MISSING_EXPRESSION, "Expected a type after ':'");
            scope.declare(annotated.name());
            parameterTypes.add(type);
        } else {
            diagnostics.reportError(CompilerErrorCode.INVALID_PARAMETER,
                    "A parameter must be a name, optionally followed by ': type'", fileName, term.position());
        }
    }

    // region Statements

    private List<IrStmt> lowerStatements(List<Stmt> statements) {
        List<IrStmt> lowered = new ArrayList<>(statements.size());
        for (Stmt statement : statements) {
            lowered.add(lowerStatement(statement));
        }
        return lowered;
    }

    private IrStmt lowerStatement(Stmt statement) {
        if (statement instanceof Stmt.Var declaration) {
            return declare(declaration.name());
        }
        if (statement instanceof Stmt.Expression expression) {
            return new IrStmt.Expr(lower(expression.term()));
        }
        Stmt.While loop = (Stmt.While) statement;
        IrExpr condition = lower(loop.condition());
        scope.enterBlock();
        List<IrStmt> body = lowerStatements(loop.body());
        scope.leaveBlock();
        return new IrStmt.While(condition, List.copyOf(body));
    }

    private IrStmt declare(Term.Identifier name) {
        if (topLevel && scope.isOutermost()) {
            Item existing = namespaces.get(fileIndex).get(name.name());
            if (existing != null && !(existing instanceof Item.GlobalVariable)) {
                diagnostics.reportError(CompilerErrorCode.DUPLICATE_DEFINITION,
                        "'" + name.name() + "' is already defined in this file", fileName, name.position());
            }
        }
        int slot = scope.declare(name.name());
        return new IrStmt.Declare(variable(slot));
    }

    private IrExpr variable(int slot) {
        return topLevel ? new IrExpr.GlobalVariable(fileIndex, slot) : new IrExpr.LocalVariable(slot);
    }

    // endregion

    // region Expressions

    private IrExpr lower(Term term) {
        if (term instanceof Term.Identifier identifier) {
            return resolveIdentifier(identifier);
        }
        if (term instanceof Term.NumericLiteral literal) {
            return new IrExpr.NumericLiteral(literal.value());
        }
        if (term instanceof Term.StringLiteral literal) {
            return lowerString(literal);
        }
        if (term instanceof Term.IntegerType) {
            return new IrExpr.UnresolvedType("int");
        }
        if (term instanceof Term.FloatType) {
            return new IrExpr.UnresolvedType("float");
        }
        if (term instanceof Term.Identity) {
            return new IrExpr.Identity();
        }
        if (term instanceof Term.Parenthesized parenthesized) {
            return lower(parenthesized.inner());
        }
        if (term instanceof Term.UnaryOperation operation) {
            String method = operation.operator().name();
            return new IrExpr.Operator(method, List.of(missingOperand(operation.operand(), operation.operator())));
        }
        if (term instanceof Term.BinaryOperation operation) {
            return new IrExpr.Operator(operation.operator().name(), List.of(
                    missingOperand(operation.left(), operation.operator()),
                    missingOperand(operation.right(), operation.operator())));
        }
        if (term instanceof Term.Assignment assignment) {
            return new IrExpr.Assign(assignment.operator().name(),
                    missingOperand(assignment.left(), assignment.operator()),
                    missingOperand(assignment.right(), assignment.operator()));
        }
        if (term instanceof Term.Conjunction conjunction) {
            return new IrExpr.And(lowerChain(conjunction.conditions(), conjunction.operatorPositions(), "&&"));
        }
        if (term instanceof Term.Disjunction disjunction) {
            return new IrExpr.Or(lowerChain(disjunction.conditions(), disjunction.operatorPositions(), "||"));
        }
        if (term instanceof Term.Tuple tuple) {
            return new IrExpr.Tuple(lowerElements(tuple.elements()));
        }
        if (term instanceof Term.FieldByName field) {
            return new IrExpr.FieldByName(lower(field.left()), field.name());
        }
        if (term instanceof Term.FieldByNumber field) {
            return new IrExpr.FieldByNumber(lower(field.left()), field.number());
        }
        if (term instanceof Term.FunctionCall call) {
            return new IrExpr.Call(lower(call.function()), lowerElements(call.arguments()));
        }
        if (term instanceof Term.TypeParameters application) {
            return new IrExpr.TypeApplication(lower(application.left()), lowerElements(application.parameters()));
        }
        if (term instanceof Term.TypeAnnotation annotation) {
            return new IrExpr.TypeAnnotation(lower(annotation.left()), required(annotation.type(),
                    annotation.colonPosition(), CompilerErrorCode.MISSING_EXPRESSION, "Expected a type after ':'"));
        }
        if (term instanceof Term.ReturnType returnType) {
            return new IrExpr.ReturnType(lower(returnType.arguments()), required(returnType.returnType(),
                    returnType.arrowPosition(), CompilerErrorCode.MISSING_EXPRESSION, "Expected a type after '->'"));
        }
        throw new IllegalArgumentException("Operator name outside of an operation at " + term.position());
    }

    private IrExpr resolveIdentifier(Term.Identifier identifier) {
        String name = identifier.name();
        Integer slot = scope.lookup(name);
        if (slot != null) {
            return variable(slot);
        }
        Item item = namespaces.get(fileIndex).get(name);
        if (item instanceof Item.Function function) {
            return new IrExpr.Function(function.definitions());
        }
        if (item instanceof Item.GlobalVariable global) {
            return new IrExpr.GlobalVariable(fileIndex, global.slot());
        }
        if (item instanceof Item.Import imported) {
            return new IrExpr.Module(imported.fileIndex());
        }
        if (item instanceof Item.Type) {
            return new IrExpr.UnresolvedType(name);
        }
        diagnostics.reportError(CompilerErrorCode.UNDEFINED_IDENTIFIER,
                "Undefined identifier '" + name + "'", fileName, identifier.position());
        return new IrExpr.Invalid();
    }

    private IrExpr lowerString(Term.StringLiteral literal) {
        List<IrExpr.StringPart> parts = new ArrayList<>();
        for (StringComponent component : literal.components()) {
            if (component instanceof StringComponent.Text text) {
                parts.add(new IrExpr.Text(text.text()));
            } else {
                StringComponent.Interpolation interpolation = (StringComponent.Interpolation) component;
                parts.add(new IrExpr.Embedded(required(interpolation.term(), interpolation.bracePosition(),
                        CompilerErrorCode.MISSING_EXPRESSION, "Expected an expression between '{' and '}'")));
            }
        }
        return new IrExpr.StringLiteral(List.copyOf(parts));
    }

    /**
     * Lowers the operands of a flat {@code &&} or {@code ||} chain. A missing operand is blamed on
     * the operator right after it, or on the last operator for the final operand.
     */
    private List<IrExpr> lowerChain(List<Term> conditions, List<SourceRange> operatorPositions, String symbol) {
        List<IrExpr> lowered = new ArrayList<>(conditions.size());
        for (int i = 0; i < conditions.size(); i++) {
            SourceRange blame = operatorPositions.get(Math.min(i, operatorPositions.size() - 1));
            lowered.add(required(conditions.get(i), blame, CompilerErrorCode.MISSING_OPERAND,
                    "Missing operand of '" + symbol + "'"));
        }
        return List.copyOf(lowered);
    }

    private List<IrExpr> lowerElements(List<ListElement> elements) {
        List<IrExpr> lowered = new ArrayList<>(elements.size());
        for (ListElement element : elements) {
            if (element instanceof ListElement.NonEmpty nonEmpty) {
                lowered.add(lower(nonEmpty.term()));
            } else {
                diagnostics.reportError(CompilerErrorCode.MISSING_EXPRESSION, "Expected an expression before ','",
                        fileName, ((ListElement.Empty) element).commaPosition());
                lowered.add(new IrExpr.Invalid());
            }
        }
        return List.copyOf(lowered);
    }

    private IrExpr missingOperand(Term operand, Term.MethodName operator) {
        return required(operand, operator.position(), CompilerErrorCode.MISSING_OPERAND,
                "Missing operand of '" + operator.name() + "'");
    }

    private IrExpr required(Term term, SourceRange blame, CompilerErrorCode code, String message) {
        if (term == null) {
            diagnostics.reportError(code, message, fileName, blame);
            return new IrExpr.Invalid();
        }
        return lower(term);
    }

    // endregion
}
