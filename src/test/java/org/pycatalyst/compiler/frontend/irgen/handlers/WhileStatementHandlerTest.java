package org.pycatalyst.compiler.frontend.irgen.handlers;

import org.pycatalyst.compiler.diagnostics.DiagnosticsEngine;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrUnit;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pycatalyst.compiler.frontend.irgen.TranslationTestSupport.fragmentAt;
import static org.pycatalyst.compiler.frontend.irgen.TranslationTestSupport.textAt;
import static org.pycatalyst.compiler.frontend.irgen.TranslationTestSupport.translateEntry;

public class WhileStatementHandlerTest {

    /**
     * Verifies a while loop with nested loop control statements.
     */
    @Test
    @Tag("unit")
    void testWhileWithLoopControl() {
        IrUnit unit = translateEntry(new DiagnosticsEngine(),
                "n = 10",
                "while n > 0 and n != 5:",
                "    n = n - 1",
                "    if n == 7:",
                "        continue",
                "    break");

        IrFunction entry = unit.entryFunction();
        assertThat(textAt(entry, 2)).isEqualTo("    while ((n > 0) && (n != 5)) {");
        assertThat(textAt(entry, 3)).isEqualTo("        n = (n - 1);");
        assertThat(textAt(entry, 4)).isEqualTo("        if (n == 7) {");
        assertThat(textAt(entry, 5)).isEqualTo("            continue;\n        }");
        assertThat(textAt(entry, 6)).isEqualTo("        break;\n    }");
    }

    @Test
    @Tag("unit")
    void testWhileElseIsRefused() {
        IrUnit unit = translateEntry(new DiagnosticsEngine(),
                "n = 1",
                "while n:",
                "    n = 0",
                "else:",
                "    n = 2");

        assertThat(fragmentAt(unit.entryFunction(), 2).reason()).isEqualTo("while-else not supported");
        assertThat(fragmentAt(unit.entryFunction(), 2).endLine()).isEqualTo(5);
    }

    @Test
    @Tag("unit")
    void testCollectionConditionIsRefused() {
        IrUnit unit = translateEntry(new DiagnosticsEngine(),
                "v = [1]",
                "while v:",
                "    break");

        assertThat(fragmentAt(unit.entryFunction(), 2).reason()).isEqualTo("collections not supported as conditions");
    }
}
