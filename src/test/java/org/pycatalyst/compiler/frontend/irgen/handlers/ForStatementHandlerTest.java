package org.pycatalyst.compiler.frontend.irgen.handlers;

import org.pycatalyst.compiler.diagnostics.DiagnosticsEngine;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrFragment;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrUnit;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pycatalyst.compiler.frontend.irgen.TranslationTestSupport.fragmentAt;
import static org.pycatalyst.compiler.frontend.irgen.TranslationTestSupport.textAt;
import static org.pycatalyst.compiler.frontend.irgen.TranslationTestSupport.translateEntry;

/**
 * Contains unit tests for the {@link ForStatementHandler}.
 * These tests verify the counting loop headers generated for range loops and the refusal of
 * every other iterable.
 */
public class ForStatementHandlerTest {

    private static String header(String loop) {
        IrUnit unit = translateEntry(new DiagnosticsEngine(), "n = 5", loop, "    pass");
        IrFragment fragment = fragmentAt(unit.entryFunction(), 2);
        return fragment.isPassThrough() ? fragment.reason() : fragment.text();
    }

    /**
     * Verifies the loop iterating over the indices of a list, with the body indented one level.
     */
    @Test
    @Tag("unit")
    void testLoopOverListIndices() {
        IrUnit unit = translateEntry(new DiagnosticsEngine(),
                "a = [1, 2, 3]",
                "for i in range(len(a)):",
                "    print(a[i])");

        IrFunction entry = unit.entryFunction();
        assertThat(textAt(entry, 1)).isEqualTo("    std::vector<int> a = {1, 2, 3};");
        assertThat(textAt(entry, 2)).isEqualTo("    for (int i = 0; i < a.size(); i++) {");
        assertThat(textAt(entry, 3)).isEqualTo("        std::cout << a[i] << std::endl;\n    }");
        assertThat(entry.locals()).doesNotContainKey("i");
    }

    @Test
    @Tag("unit")
    void testRangeShapes() {
        assertThat(header("for i in range(n):")).isEqualTo("    for (int i = 0; i < n; i++) {");
        assertThat(header("for i in range(1, n):")).isEqualTo("    for (int i = 1; i < n; i++) {");
        assertThat(header("for i in range(0, n, 2):")).isEqualTo("    for (int i = 0; i < n; i += 2) {");
        assertThat(header("for i in range(n, 0, -1):")).isEqualTo("    for (int i = n; i > 0; i--) {");
        assertThat(header("for i in range(n, 0, -3):")).isEqualTo("    for (int i = n; i > 0; i -= 3) {");
        assertThat(header("for i in 4:")).isEqualTo("    for (int i = 0; i < 4; i++) {");
    }

    @Test
    @Tag("unit")
    void testLoopVariableIsScopedToTheLoop() {
        IrUnit unit = translateEntry(new DiagnosticsEngine(),
                "for i in range(3):",
                "    x = i",
                "for i in range(2):",
                "    x = 1.5",
                "i = 'done'");

        IrFunction entry = unit.entryFunction();
        assertThat(textAt(entry, 2)).isEqualTo("        int x = i;\n    }");
        assertThat(textAt(entry, 3)).isEqualTo("    for (int i = 0; i < 2; i++) {");
        assertThat(textAt(entry, 4)).isEqualTo("        double x = 1.5;\n    }");
        assertThat(textAt(entry, 5)).isEqualTo("    std::string i = \"done\";");
        assertThat(entry.locals()).containsOnlyKeys("i");
        assertThat(entry.locals().get("i").type().get()).isEqualTo(TypeTag.STR);
    }

    @Test
    @Tag("unit")
    void testLiteralBoundsMustFitAnInt() {
        assertThat(header("for i in 3000000000:")).isEqualTo("integer literal 3000000000 out of int range");
        assertThat(header("for i in range(0, 3000000000):")).isEqualTo("integer literal 3000000000 out of int range");
        assertThat(header("for i in range(0, n, 4294967297):")).isEqualTo("integer literal 4294967297 out of int range");
        assertThat(header("for i in -1:")).isEqualTo("only range() loops supported");
    }

    /**
     * Verifies the refusal reason of each unsupported loop shape.
     */
    @Test
    @Tag("unit")
    void testRefusedLoops() {
        assertThat(header("for i in [1, 2]:")).isEqualTo("only range() loops supported");
        assertThat(header("for i, j in range(n):")).isEqualTo("only a single loop variable supported");
        assertThat(header("for i in range():")).isEqualTo("range() expects 1 to 3 arguments");
        assertThat(header("for i in range(1.5):")).isEqualTo("range() arguments must be int, got float");
        assertThat(header("for i in range(0, n, n):")).isEqualTo("range() step must be an integer literal");
        assertThat(header("for i in range(0, n, 0):")).isEqualTo("range() step must not be zero");
    }

    /**
     * A loop may not reuse a name that is already declared, since the counter is declared in
     * the loop header.
     */
    @Test
    @Tag("unit")
    void testLoopVariableConflicts() {
        IrUnit unit = translateEntry(new DiagnosticsEngine(),
                "s = 'a'",
                "v = [1]",
                "for s in range(2):",
                "    pass",
                "for v in range(2):",
                "    pass",
                "n = 0",
                "for n in range(2):",
                "    pass",
                "for i in range(2):",
                "    pass",
                "else:",
                "    pass");

        IrFunction entry = unit.entryFunction();
        assertThat(fragmentAt(entry, 3).reason()).isEqualTo("loop variable 's' is already declared");
        assertThat(fragmentAt(entry, 5).reason()).isEqualTo("loop variable 'v' is a collection");
        assertThat(fragmentAt(entry, 8).reason()).isEqualTo("loop variable 'n' is already declared");
        assertThat(fragmentAt(entry, 10).reason()).isEqualTo("for-else not supported");
    }
}
