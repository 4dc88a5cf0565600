package org.pycatalyst.compiler.frontend.irgen.handlers;

import org.pycatalyst.compiler.diagnostics.DiagnosticsEngine;
import org.pycatalyst.compiler.frontend.irgen.TranslationContext;
import org.pycatalyst.compiler.frontend.parser.ast.StatementNode;
import org.pycatalyst.compiler.frontend.semantics.TypeSlot;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrClass;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrUnit;
import org.pycatalyst.compiler.ir.IrVariable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pycatalyst.compiler.frontend.irgen.TranslationTestSupport.context;
import static org.pycatalyst.compiler.frontend.irgen.TranslationTestSupport.fragmentAt;
import static org.pycatalyst.compiler.frontend.irgen.TranslationTestSupport.parse;
import static org.pycatalyst.compiler.frontend.irgen.TranslationTestSupport.textAt;
import static org.pycatalyst.compiler.frontend.irgen.TranslationTestSupport.translateEntry;

/**
 * Contains unit tests for the {@link ReturnStatementHandler}.
 */
public class ReturnStatementHandlerTest {

    private static void translateBody(IrUnit unit, IrFunction function, List<String> body) {
        TranslationContext ctx = context(unit, function, body, new DiagnosticsEngine());
        for (StatementNode statement : parse(body).body()) {
            ctx.translate(statement);
        }
    }

    /**
     * Every returned value widens the return type of the function in place.
     */
    @Test
    @Tag("unit")
    void testReturnValuesRefineReturnType() {
        IrUnit unit = new IrUnit("test.py", 3);
        IrFunction f = IrFunction.free("f", 0, 3);
        f.addParameter(new IrVariable("x", 0, new TypeSlot(TypeTag.FLOAT), "f"));
        unit.registerFunction(f);

        translateBody(unit, f, List.of("if x > 0:", "    return 1", "return x"));

        assertThat(textAt(f, 2)).isEqualTo("        return 1;\n    }");
        assertThat(textAt(f, 3)).isEqualTo("    return x;");
        assertThat(f.returnType().get()).isEqualTo(TypeTag.FLOAT);
    }

    @Test
    @Tag("unit")
    void testBareReturnKeepsVoid() {
        IrUnit unit = new IrUnit("test.py", 1);
        IrFunction f = IrFunction.free("f", 0, 1);
        unit.registerFunction(f);

        translateBody(unit, f, List.of("return"));

        assertThat(textAt(f, 1)).isEqualTo("    return;");
        assertThat(f.returnType().get()).isEqualTo(TypeTag.VOID);
    }

    @Test
    @Tag("unit")
    void testConstructorCannotReturnValue() {
        IrUnit unit = new IrUnit("test.py", 2);
        IrClass owner = new IrClass("P", 0, 2, List.of());
        unit.registerClass(owner);
        IrFunction init = IrFunction.method("P", IrClass.CONSTRUCTOR_NAME, "self", 0, 2);
        owner.addMethod(init);
        unit.registerFunction(init);

        translateBody(unit, init, List.of("return", "return 1"));

        assertThat(textAt(init, 1)).isEqualTo("    return;");
        assertThat(fragmentAt(init, 2).reason()).isEqualTo("returning a value from a constructor not supported");
        assertThat(init.returnType().get()).isEqualTo(TypeTag.CONSTRUCTOR);
    }

    @Test
    @Tag("unit")
    void testReturnAtTopLevelIsRefused() {
        IrUnit unit = translateEntry(new DiagnosticsEngine(), "return 1");

        assertThat(fragmentAt(unit.entryFunction(), 1).reason()).isEqualTo("return outside a function not supported");
    }
}
