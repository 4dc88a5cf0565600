package org.pycatalyst.compiler.frontend.signatures;

import org.pycatalyst.compiler.diagnostics.DiagnosticsEngine;
import org.pycatalyst.compiler.frontend.lexer.Lexer;
import org.pycatalyst.compiler.frontend.parser.Parser;
import org.pycatalyst.compiler.frontend.parser.ast.ClassDefNode;
import org.pycatalyst.compiler.frontend.parser.ast.FunctionDefNode;
import org.pycatalyst.compiler.frontend.parser.ast.ModuleNode;
import org.pycatalyst.compiler.frontend.parser.ast.StatementNode;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrClass;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrUnit;
import org.pycatalyst.compiler.ir.IrVariable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the pass-1 signature collectors.
 * These tests verify that functions, classes and methods are registered with their parameters
 * and that every unsupported declaration is recorded as skipped with a reason.
 */
public class SignatureCollectorTest {

    private static SignatureContext collect(String... lines) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        String source = String.join("\n", lines) + "\n";
        ModuleNode module = new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parse(lines.length);
        assertThat(diagnostics.hasErrors()).isFalse();
        SignatureContext ctx = new SignatureContext(new IrUnit("test.py", lines.length));
        ISignatureCollector classes = new ClassSignatureCollector();
        ISignatureCollector functions = new FunctionSignatureCollector();
        for (StatementNode statement : module.body()) {
            if (statement instanceof ClassDefNode) {
                classes.collect(statement, ctx);
            }
        }
        for (StatementNode statement : module.body()) {
            if (statement instanceof FunctionDefNode) {
                functions.collect(statement, ctx);
            }
        }
        return ctx;
    }

    /**
     * Parameters start as auto; a literal default fixes the type and keeps its C++ spelling.
     */
    @Test
    @Tag("unit")
    void testFunctionParameters() {
        SignatureContext ctx = collect(
                "def f(a, b=2, c=-1.5, d='x', e=True):",
                "    pass");

        IrFunction f = ctx.unit().function("f").orElseThrow();
        assertThat(f.parameters().values()).extracting(IrVariable::name).containsExactly("a", "b", "c", "d", "e");
        assertThat(f.parameters().values()).extracting(p -> p.type().get())
                .containsExactly(TypeTag.AUTO, TypeTag.INT, TypeTag.FLOAT, TypeTag.STR, TypeTag.BOOL);
        assertThat(f.parameters().values()).extracting(IrVariable::defaultLiteral)
                .containsExactly(null, "2", "-1.5", "\"x\"", "true");
        assertThat(f.requiredParameterCount()).isEqualTo(1);
        assertThat(f.returnType().get()).isEqualTo(TypeTag.VOID);
        assertThat(f.lineno()).isEqualTo(1);
        assertThat(f.endLineno()).isEqualTo(2);
        assertThat(ctx.bodies()).containsKey(f);
        assertThat(ctx.skipped()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testUnsupportedFunctions() {
        SignatureContext ctx = collect(
                "@decorator",
                "def a():",
                "    pass",
                "def b(*args):",
                "    pass",
                "def c(x, x):",
                "    pass",
                "def d(x=[]):",
                "    pass",
                "def e():",
                "    pass",
                "def e():",
                "    pass");

        assertThat(ctx.skipped()).extracting(SkippedDeclaration::reason).containsExactly(
                "decorated functions not supported",
                "only plain positional parameters supported",
                "duplicate parameter 'x'",
                "default of 'x' must be a literal",
                "duplicate definition of 'e'");
        assertThat(ctx.unit().freeFunctions()).extracting(IrFunction::name).containsExactly("e");
    }

    /**
     * Methods drop their receiver parameter; a constructor gets the constructor return sentinel.
     */
    @Test
    @Tag("unit")
    void testClassWithMethods() {
        SignatureContext ctx = collect(
                "class P(Base):",
                "    pass",
                "    def __init__(self, x):",
                "        self.x = x",
                "    def get(this):",
                "        return this.x");

        IrClass p = ctx.unit().classNamed("P").orElseThrow();
        assertThat(p.bases()).containsExactly("Base");
        assertThat(p.methods()).containsOnlyKeys("__init__", "get");
        IrFunction init = p.methods().get("__init__");
        assertThat(init.isConstructor()).isTrue();
        assertThat(init.parameters()).containsOnlyKeys("x");
        IrFunction get = ctx.unit().function("P::get").orElseThrow();
        assertThat(get.receiverName()).isEqualTo("this");
        assertThat(get.ownerClass()).contains("P");
        assertThat(ctx.bodies()).hasSize(2);
        assertThat(ctx.skipped()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testUnsupportedClassMembers() {
        SignatureContext ctx = collect(
                "class P:",
                "    count = 0",
                "    def m():",
                "        pass",
                "    def n(self=1):",
                "        pass",
                "    def o(self):",
                "        pass",
                "    def o(self):",
                "        pass",
                "class Q(mod.Base):",
                "    pass",
                "class R(metaclass=M):",
                "    pass");

        assertThat(ctx.skipped()).extracting(SkippedDeclaration::reason).containsExactly(
                "class-level statements not supported",
                "method without receiver parameter not supported",
                "receiver parameter with default not supported",
                "duplicate definition of 'P.o'",
                "only plain base class names supported",
                "class keywords not supported");
        assertThat(ctx.unit().classes()).containsOnlyKeys("P");
    }

    /**
     * Classes are registered before functions, so a function cannot take a class name.
     */
    @Test
    @Tag("unit")
    void testFunctionCannotShadowClass() {
        SignatureContext ctx = collect(
                "def P():",
                "    pass",
                "class P:",
                "    pass");

        assertThat(ctx.unit().classNamed("P")).isPresent();
        assertThat(ctx.unit().function("P")).isEmpty();
        assertThat(ctx.skipped()).extracting(SkippedDeclaration::reason).containsExactly("duplicate definition of 'P'");
    }
}
