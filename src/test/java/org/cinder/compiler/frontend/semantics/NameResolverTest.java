package org.cinder.compiler.frontend.semantics;

import org.cinder.compiler.api.CompilerErrorCode;
import org.cinder.compiler.api.SourceIndex;
import org.cinder.compiler.api.SourceRange;
import org.cinder.compiler.diagnostics.Diagnostic;
import org.cinder.compiler.diagnostics.DiagnosticsEngine;
import org.cinder.compiler.frontend.module.ModuleLoader;
import org.cinder.compiler.frontend.module.ModuleTable;
import org.cinder.compiler.ir.IrExpr;
import org.cinder.compiler.ir.IrFunction;
import org.cinder.compiler.ir.IrModule;
import org.cinder.compiler.ir.IrProgram;
import org.cinder.compiler.ir.IrStmt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the {@link NameResolver} on programs read from a temporary directory: slot assignment,
 * shadowing, identifier resolution across scopes and namespaces, and the errors it reports.
 */
public class NameResolverTest {

    @TempDir
    Path tempDir;

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private void write(String name, String... lines) throws IOException {
        Files.writeString(tempDir.resolve(name), String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
    }

    private IrProgram resolve(String... rootLines) throws Exception {
        write("main.cinder", rootLines);
        ModuleTable table = new ModuleLoader(diagnostics, "cinder").load(tempDir.resolve("main.cinder"));
        assertThat(diagnostics.getDiagnostics()).as("parse diagnostics").isEmpty();
        return new NameResolver(table, diagnostics).resolve();
    }

    private static IrModule root(IrProgram program) {
        return program.modules().get(program.rootIndex());
    }

    private static IrExpr.GlobalVariable global(int slot) {
        return new IrExpr.GlobalVariable(0, slot);
    }

    private static IrExpr.LocalVariable local(int slot) {
        return new IrExpr.LocalVariable(slot);
    }

    private static SourceRange range(int line, int startColumn, int endColumn) {
        return new SourceRange(new SourceIndex(line, startColumn), new SourceIndex(line, endColumn));
    }

    /**
     * Verifies that top-level variables get dense global slots in declaration order.
     */
    @Test
    @Tag("integration")
    void testGlobalSlotsAreDense() throws Exception {
        // Act
        IrProgram program = resolve("var a", "var b", "a = b");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        IrModule module = root(program);
        assertThat(module.globalCount()).isEqualTo(2);
        assertThat(module.statements()).containsExactly(
                new IrStmt.Declare(global(0)),
                new IrStmt.Declare(global(1)),
                new IrStmt.Expr(new IrExpr.Assign("assign", global(0), global(1))));
    }

    /**
     * Verifies that a {@code var x} inside a loop body does not change what {@code x} means after the loop.
     */
    @Test
    @Tag("integration")
    void testShadowingInsideLoopIsRestored() throws Exception {
        // Act
        IrProgram program = resolve(
                "var x",
                "while x",
                "  var x",
                "  x",
                "end",
                "x");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(root(program).statements()).containsExactly(
                new IrStmt.Declare(global(0)),
                new IrStmt.While(global(0), List.of(
                        new IrStmt.Declare(global(1)),
                        new IrStmt.Expr(global(1)))),
                new IrStmt.Expr(global(0)));
        assertThat(root(program).globalCount()).isEqualTo(2);
    }

    /**
     * Verifies that parameters take the first local slots with their declared types, that the return
     * type is kept, and that loop-local variables keep their own slot without being reused.
     */
    @Test
    @Tag("integration")
    void testFunctionLocals() throws Exception {
        // Act
        IrProgram program = resolve(
                "func f(a, b: int) -> float",
                "  var c",
                "  while a",
                "    var a",
                "    a + c",
                "  end",
                "  a",
                "end");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        IrFunction function = program.functions().get(0);
        assertThat(function.name()).isEqualTo("f");
        assertThat(function.parameterCount()).isEqualTo(2);
        assertThat(function.parameterTypes()).containsExactly(null, new IrExpr.UnresolvedType("int"));
        assertThat(function.returnType()).isEqualTo(new IrExpr.UnresolvedType("float"));
        assertThat(function.localCount()).isEqualTo(4);
        assertThat(function.fileIndex()).isEqualTo(program.rootIndex());
        assertThat(function.body()).containsExactly(
                new IrStmt.Declare(local(2)),
                new IrStmt.While(local(0), List.of(
                        new IrStmt.Declare(local(3)),
                        new IrStmt.Expr(new IrExpr.Operator("add", List.of(local(3), local(2)))))),
                new IrStmt.Expr(local(0)));
    }

    /**
     * Verifies that top-level variables are visible inside function bodies, even when declared later.
     */
    @Test
    @Tag("integration")
    void testGlobalsVisibleInFunctions() throws Exception {
        // Act
        IrProgram program = resolve(
                "func add(n)",
                "  total += n",
                "end",
                "var total");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(program.functions().get(0).body()).containsExactly(
                new IrStmt.Expr(new IrExpr.Assign("add_assign", global(0), local(0))));
    }

    /**
     * Verifies that function names resolve to their overload set and import names to the module index.
     */
    @Test
    @Tag("integration")
    void testFunctionAndModuleReferences() throws Exception {
        // Arrange
        write("lib.cinder", "var shared");

        // Act
        IrProgram program = resolve(
                "import lib",
                "func f()",
                "end",
                "func f(x)",
                "end",
                "f(lib.shared)");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(program.rootIndex()).isEqualTo(1);
        assertThat(root(program).statements()).containsExactly(new IrStmt.Expr(new IrExpr.Call(
                new IrExpr.Function(List.of(0, 1)),
                List.of(new IrExpr.FieldByName(new IrExpr.Module(0), "shared")))));
    }

    /**
     * Verifies that every undefined identifier is reported with its name and position, and that
     * resolution continues after the first one.
     */
    @Test
    @Tag("integration")
    void testUndefinedIdentifiers() throws Exception {
        // Act
        IrProgram program = resolve(
                "var a",
                "missing + a",
                "func g()",
                "  other",
                "end");

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).containsExactly(
                CompilerErrorCode.UNDEFINED_IDENTIFIER, CompilerErrorCode.UNDEFINED_IDENTIFIER);
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::message).containsExactly(
                "Undefined identifier 'missing'", "Undefined identifier 'other'");
        assertThat(diagnostics.getDiagnostics()).extracting(d -> d.positions().get(0))
                .containsExactly(range(1, 0, 7), range(3, 2, 7));
        assertThat(root(program).statements().get(1)).isEqualTo(new IrStmt.Expr(
                new IrExpr.Operator("add", List.of(new IrExpr.Invalid(), global(0)))));
    }

    /**
     * Verifies that a function without annotations has no declared types, and that a parameter type
     * naming a global variable resolves like any other expression.
     */
    @Test
    @Tag("integration")
    void testUndeclaredAndResolvedTypes() throws Exception {
        // Act
        IrProgram program = resolve(
                "var shape",
                "func plain(x)",
                "end",
                "func typed(y: shape) -> shape",
                "end");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        IrFunction plain = program.functions().get(0);
        assertThat(plain.parameterTypes()).containsExactly((IrExpr) null);
        assertThat(plain.returnType()).isNull();
        IrFunction typed = program.functions().get(1);
        assertThat(typed.parameterTypes()).containsExactly(global(0));
        assertThat(typed.returnType()).isEqualTo(global(0));
    }

    /**
     * Verifies that the locals of one function cannot be named in another.
     */
    @Test
    @Tag("integration")
    void testLocalsOfOneFunctionAreInvisibleInAnother() throws Exception {
        resolve(
                "func f()",
                "  var secret",
                "end",
                "func g()",
                "  secret",
                "end");

        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.UNDEFINED_IDENTIFIER);
    }

    /**
     * Verifies that parameters other than names and empty parameter slots are reported.
     */
    @Test
    @Tag("integration")
    void testInvalidAndEmptyParameters() throws Exception {
        resolve(
                "func f(1, , b)",
                "end");

        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).containsExactly(
                CompilerErrorCode.INVALID_PARAMETER, CompilerErrorCode.MISSING_EXPRESSION);
        assertThat(diagnostics.getDiagnostics()).extracting(d -> d.positions().get(0))
                .containsExactly(range(0, 7, 8), range(0, 10, 11));
    }

    /**
     * Verifies that missing operands are blamed on their operator.
     */
    @Test
    @Tag("integration")
    void testMissingOperands() throws Exception {
        // Act
        resolve(
                "var a",
                "(a +)",
                "(a &&)",
                "(a, , a)");

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code).containsExactly(
                CompilerErrorCode.MISSING_OPERAND, CompilerErrorCode.MISSING_OPERAND, CompilerErrorCode.MISSING_EXPRESSION);
        assertThat(diagnostics.getDiagnostics()).extracting(d -> d.positions().get(0))
                .containsExactly(range(1, 3, 4), range(2, 3, 5), range(3, 4, 5));
    }

    /**
     * Verifies that a top-level variable may not reuse the name of a function.
     */
    @Test
    @Tag("integration")
    void testTopLevelVariableCollidingWithFunction() throws Exception {
        resolve(
                "func x()",
                "end",
                "var x");

        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.DUPLICATE_DEFINITION);
        assertThat(diagnostics.getDiagnostics().get(0).positions()).containsExactly(range(2, 4, 5));
    }

    /**
     * Verifies the lowering of builtin types, the wildcard and interpolated strings.
     */
    @Test
    @Tag("integration")
    void testTypesWildcardAndStrings() throws Exception {
        // Act
        IrProgram program = resolve(
                "var n",
                "n: int",
                "_ = n",
                "\"n={n}\"");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(root(program).statements()).containsExactly(
                new IrStmt.Declare(global(0)),
                new IrStmt.Expr(new IrExpr.TypeAnnotation(global(0), new IrExpr.UnresolvedType("int"))),
                new IrStmt.Expr(new IrExpr.Assign("assign", new IrExpr.Identity(), global(0))),
                new IrStmt.Expr(new IrExpr.StringLiteral(List.of(
                        new IrExpr.Text("n="), new IrExpr.Embedded(global(0))))));
    }

    /**
     * Verifies that an empty interpolation is reported at its opening brace.
     */
    @Test
    @Tag("integration")
    void testEmptyInterpolationIsReported() throws Exception {
        resolve("\"{}\"");

        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.MISSING_EXPRESSION);
        assertThat(diagnostics.getDiagnostics().get(0).positions()).containsExactly(range(0, 1, 2));
    }
}
