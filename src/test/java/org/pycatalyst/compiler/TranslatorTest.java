package org.pycatalyst.compiler;

import org.pycatalyst.compiler.api.TranslationException;
import org.pycatalyst.compiler.api.TranslatorOptions;
import org.pycatalyst.compiler.backend.emit.CommentStitcher;
import org.pycatalyst.compiler.backend.emit.CppRenderer;
import org.pycatalyst.compiler.diagnostics.Diagnostic;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrDependency;
import org.pycatalyst.compiler.ir.IrFragment;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of the {@link Translator} pipeline: script lines in, translated unit (and
 * rendered C++) out.
 */
public class TranslatorTest {

    private Translator translator;

    @BeforeEach
    void setUp() {
        translator = new Translator();
    }

    private IrUnit translate(String... lines) throws TranslationException {
        return translator.translate(List.of(lines), "test.py");
    }

    private static IrFragment fragmentAt(IrFunction function, int line) {
        return function.fragments().stream()
                .filter(f -> f.startLine() == line)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No fragment at line " + line + ": " + function.fragments()));
    }

    private String render(List<String> lines) throws TranslationException {
        IrUnit unit = translator.translate(lines, "test.py");
        new CommentStitcher(TranslatorOptions.defaults()).stitch(unit, lines);
        return new CppRenderer(TranslatorOptions.defaults()).render(unit);
    }

    /**
     * A float assigned to an int variable is refused and the variable stays an int.
     */
    @Test
    @Tag("integration")
    void testNarrowingReassignmentIsPassedThrough() throws TranslationException {
        IrUnit unit = translate("x = 10", "x = 3.3");

        IrFunction entry = unit.entryFunction();
        assertThat(fragmentAt(entry, 1).text()).isEqualTo("    int x = 10;");
        assertThat(fragmentAt(entry, 2).text())
                .isEqualTo("    // Not translated: cannot assign float to 'x' of type int\n    // x = 3.3");
        assertThat(entry.locals().get("x").type().get()).isEqualTo(TypeTag.INT);
        assertThat(translator.getDiagnostics().ofType(Diagnostic.Type.WARNING)).hasSize(1);
    }

    @Test
    @Tag("integration")
    void testWideningReassignmentIsAccepted() throws TranslationException {
        IrUnit unit = translate("y = 2.5", "y = 1");

        assertThat(fragmentAt(unit.entryFunction(), 2).text()).isEqualTo("    y = 1;");
        assertThat(unit.entryFunction().locals().get("y").type().get()).isEqualTo(TypeTag.FLOAT);
        assertThat(translator.getDiagnostics().getDiagnostics()).isEmpty();
    }

    /**
     * A refused condition passes the whole conditional through as one fragment.
     */
    @Test
    @Tag("integration")
    void testMembershipConditionIsPassedThrough() throws TranslationException {
        IrUnit unit = translate(
                "a = [1, 2, 3]",
                "x = 2",
                "if x in a:",
                "    print(x)");

        IrFragment refused = fragmentAt(unit.entryFunction(), 3);
        assertThat(refused.reason()).isEqualTo("membership tests not supported");
        assertThat(refused.startLine()).isEqualTo(3);
        assertThat(refused.endLine()).isEqualTo(4);
    }

    @Test
    @Tag("integration")
    void testLoopOverList() throws TranslationException {
        IrUnit unit = translate(
                "a = [1, 2, 3]",
                "for i in range(len(a)):",
                "    print(a[i])");

        IrFunction entry = unit.entryFunction();
        assertThat(fragmentAt(entry, 1).text()).isEqualTo("    std::vector<int> a = {1, 2, 3};");
        assertThat(fragmentAt(entry, 2).text()).isEqualTo("    for (int i = 0; i < a.size(); i++) {");
        assertThat(fragmentAt(entry, 3).text()).isEqualTo("        std::cout << a[i] << std::endl;\n    }");
        assertThat(unit.dependencies()).containsExactly(IrDependency.VECTOR, IrDependency.IOSTREAM);
    }

    /**
     * Elements appended to a list must match its element type.
     */
    @Test
    @Tag("integration")
    void testListElementsKeepTheirType() throws TranslationException {
        IrUnit unit = translate(
                "b = [1, 2, 3]",
                "b.append(4)",
                "c = b[0]",
                "b.append(4.5)");

        IrFunction entry = unit.entryFunction();
        assertThat(fragmentAt(entry, 2).text()).isEqualTo("    b.push_back(4);");
        assertThat(fragmentAt(entry, 3).text()).isEqualTo("    int c = b[0];");
        assertThat(fragmentAt(entry, 4).reason()).isEqualTo("element of type float does not match int");
    }

    /**
     * A class whose constructor sets an attribute and whose method reads it.
     */
    @Test
    @Tag("integration")
    void testClassRendering() throws TranslationException {
        String cpp = render(List.of(
                "class P:",
                "    def __init__(self):",
                "        self.x = 5",
                "    def get(self):",
                "        return self.x + 1"));

        assertThat(cpp).isEqualTo("class P;\n\n"
                + "class P {\n"
                + "public:\n"
                + "    int x;\n"
                + "\n"
                + "    P() {\n"
                + "        this->x = 5;\n"
                + "    }\n"
                + "\n"
                + "    int get() {\n"
                + "        return (this->x + 1);\n"
                + "    }\n"
                + "};\n"
                + "\n"
                + "int main(int argc, char **argv) {\n"
                + "    return 0;\n"
                + "}\n");
    }

    /**
     * Call sites sharpen parameter types, comments are stitched back in and free functions are
     * declared before the entry function.
     */
    @Test
    @Tag("integration")
    void testFunctionsAndComments() throws TranslationException {
        String cpp = render(List.of(
                "# Compute things",
                "def area(w, h=2):",
                "    # product",
                "    return w * h",
                "",
                "x = area(3)  # call",
                "print(x)"));

        assertThat(cpp).isEqualTo("#include <iostream>\n\n"
                + "int area(int w, int h = 2);\n\n"
                + "int main(int argc, char **argv) {\n"
                + "    // Compute things\n"
                + "    int x = area(3); // call\n"
                + "    std::cout << x << std::endl;\n"
                + "    return 0;\n"
                + "}\n"
                + "\n"
                + "int area(int w, int h) {\n"
                + "    // product\n"
                + "    return (w * h);\n"
                + "}\n");
    }

    /**
     * Declarations refused in pass 1 are passed through at the end of the entry function.
     */
    @Test
    @Tag("integration")
    void testSkippedDeclarationsArePassedThrough() throws TranslationException {
        IrUnit unit = translate(
                "def f(*args):",
                "    pass",
                "y = 1");

        IrFunction entry = unit.entryFunction();
        assertThat(unit.function("f")).isEmpty();
        assertThat(fragmentAt(entry, 1).text()).isEqualTo(
                "    // Not translated: only plain positional parameters supported\n"
                        + "    // def f(*args):\n"
                        + "    //     pass");
        assertThat(fragmentAt(entry, 3).text()).isEqualTo("    int y = 1;");
        assertThat(translator.getDiagnostics().ofType(Diagnostic.Type.WARNING)).extracting(Diagnostic::message)
                .containsExactly("Passed through: only plain positional parameters supported");
    }

    /**
     * A recursive call is typed auto while its function is being translated, so the return
     * type is settled by the other return statements.
     */
    @Test
    @Tag("integration")
    void testRecursiveCall() throws TranslationException {
        IrUnit unit = translate(
                "def fact(n):",
                "    if n > 1:",
                "        return n * fact(n - 1)",
                "    return 1",
                "print(fact(5))");

        IrFunction fact = unit.function("fact").orElseThrow();
        assertThat(fact.returnType().get()).isEqualTo(TypeTag.INT);
        assertThat(fact.parameters().get("n").type().get()).isEqualTo(TypeTag.INT);
        assertThat(fact.fragments()).noneMatch(IrFragment::isPassThrough);
        assertThat(fragmentAt(fact, 3).text()).contains("return (n * fact((n - 1)));");
        assertThat(translator.getDiagnostics().ofType(Diagnostic.Type.WARNING)).isEmpty();
    }

    @Test
    @Tag("integration")
    void testCallToLaterFunction() throws TranslationException {
        IrUnit unit = translate(
                "def a():",
                "    return b()",
                "def b():",
                "    return 1",
                "def g():",
                "    pass",
                "x = a()",
                "y = g()");

        IrFunction a = unit.function("a").orElseThrow();
        assertThat(fragmentAt(a, 2).isPassThrough()).isFalse();
        assertThat(a.returnType().get()).isEqualTo(TypeTag.AUTO);
        assertThat(unit.function("b").orElseThrow().returnType().get()).isEqualTo(TypeTag.INT);
        assertThat(fragmentAt(unit.entryFunction(), 7).isPassThrough()).isFalse();
        assertThat(fragmentAt(unit.entryFunction(), 8).reason()).isEqualTo("call without return value used as value");
    }

    @Test
    @Tag("integration")
    void testOversizedLiteralPassesOnlyItsLine() throws TranslationException {
        IrUnit unit = translate(
                "x = 1",
                "y = 99999999999999999999",
                "z = 2");

        IrFunction entry = unit.entryFunction();
        assertThat(fragmentAt(entry, 1).text()).isEqualTo("    int x = 1;");
        assertThat(fragmentAt(entry, 2).reason()).isEqualTo("integer literal 99999999999999999999 out of int range");
        assertThat(fragmentAt(entry, 3).text()).isEqualTo("    int z = 2;");
    }

    /**
     * Only the first string of a body is a docstring; later ones are passed through.
     */
    @Test
    @Tag("integration")
    void testFunctionDocstring() throws TranslationException {
        IrUnit unit = translate(
                "def f():",
                "    'Does nothing.'",
                "    'Nor this.'");

        IrFunction f = unit.function("f").orElseThrow();
        assertThat(fragmentAt(f, 2).text()).isEqualTo("    /*\n    Does nothing.\n    */");
        assertThat(fragmentAt(f, 3).reason()).isEqualTo("expression statement has no effect");
    }

    /**
     * Names declared inside a block are not visible after it closes.
     */
    @Test
    @Tag("integration")
    void testBlockScopedDeclarations() throws TranslationException {
        IrUnit unit = translate(
                "for i in range(2):",
                "    pass",
                "for i in range(3):",
                "    t = i",
                "print(i)",
                "print(t)",
                "t = 1.5");

        IrFunction entry = unit.entryFunction();
        assertThat(fragmentAt(entry, 1).text()).isEqualTo("    for (int i = 0; i < 2; i++) {");
        assertThat(fragmentAt(entry, 3).text()).isEqualTo("    for (int i = 0; i < 3; i++) {");
        assertThat(fragmentAt(entry, 4).text()).isEqualTo("        int t = i;\n    }");
        assertThat(fragmentAt(entry, 5).reason()).isEqualTo("'i' used before declaration");
        assertThat(fragmentAt(entry, 6).reason()).isEqualTo("'t' used before declaration");
        assertThat(fragmentAt(entry, 7).text()).isEqualTo("    double t = 1.5;");
        assertThat(entry.locals()).containsOnlyKeys("t");
    }

    /**
     * A one-line conditional whose body is refused keeps its header translated; the source
     * line, trailing comment included, appears once inside the pass-through.
     */
    @Test
    @Tag("integration")
    void testOneLineConditionalWithRefusedBody() throws TranslationException {
        List<String> lines = List.of(
                "c = True",
                "if c: x = None  # note");

        IrFragment merged = fragmentAt(translate(lines.toArray(new String[0])).entryFunction(), 2);
        assertThat(merged.isPassThrough()).isFalse();
        assertThat(merged.text()).startsWith("    if (c) {\n");

        String cpp = render(lines);
        assertThat(cpp).contains("// Not translated: None not supported");
        assertThat(cpp.split("# note", -1)).hasSize(2);
        assertThat(cpp).doesNotContain("// note");
    }

    @Test
    @Tag("integration")
    void testSyntaxErrorAborts() {
        assertThatThrownBy(() -> translate("def f(:", "    pass"))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("[ERROR] test.py:1:");
        assertThat(translator.getDiagnostics().hasErrors()).isTrue();
    }

    @Test
    @Tag("integration")
    void testEmptyScript() throws TranslationException {
        IrUnit unit = translate();

        assertThat(unit.entryFunction().fragments()).isEmpty();
        assertThat(new CppRenderer(TranslatorOptions.defaults()).render(unit))
                .isEqualTo("int main(int argc, char **argv) {\n    return 0;\n}\n");
    }
}
