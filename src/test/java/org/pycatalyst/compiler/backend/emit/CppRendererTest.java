package org.pycatalyst.compiler.backend.emit;

import org.pycatalyst.compiler.api.TranslatorOptions;
import org.pycatalyst.compiler.frontend.semantics.TypeSlot;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrClass;
import org.pycatalyst.compiler.ir.IrDependency;
import org.pycatalyst.compiler.ir.IrFragment;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrUnit;
import org.pycatalyst.compiler.ir.IrVariable;
import org.pycatalyst.compiler.ir.IrVector;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link CppRenderer}, built on hand-made units.
 */
public class CppRendererTest {

    private final CppRenderer renderer = new CppRenderer(TranslatorOptions.defaults());

    @Test
    @Tag("unit")
    void testEmptyUnitRendersMainOnly() {
        IrUnit unit = new IrUnit("empty.py", 1);

        assertThat(renderer.render(unit)).isEqualTo("int main(int argc, char **argv) {\n    return 0;\n}\n");
    }

    @Test
    @Tag("unit")
    void testSignatureSpellsDefaultsOnlyInPrototypes() {
        IrFunction scale = IrFunction.free("scale", 1, 2);
        scale.addParameter(new IrVariable("v", 1, new TypeSlot(TypeTag.FLOAT), "scale"));
        scale.addParameter(new IrVariable("k", 1, new TypeSlot(TypeTag.INT), "scale", "2"));
        scale.returnType().unify(TypeTag.FLOAT);

        assertThat(renderer.signature(scale, true)).isEqualTo("double scale(double v, int k = 2)");
        assertThat(renderer.signature(scale, false)).isEqualTo("double scale(double v, int k)");
    }

    @Test
    @Tag("unit")
    void testConstructorSignatureHasNoReturnType() {
        IrFunction init = IrFunction.method("Point", IrClass.CONSTRUCTOR_NAME, "self", 2, 3);
        init.addParameter(new IrVariable("x", 2, new TypeSlot(TypeTag.INT), "Point::__init__"));

        assertThat(renderer.signature(init, false)).isEqualTo("Point(int x)");
    }

    @Test
    @Tag("unit")
    void testVoidFunctionWithoutParameters() {
        IrFunction hello = IrFunction.free("hello", 1, 2);

        assertThat(renderer.signature(hello, true)).isEqualTo("void hello()");
    }

    /**
     * Verifies the overall layout: includes, prototypes, main, then the definitions.
     */
    @Test
    @Tag("unit")
    void testLayoutOfFreeFunctionsAndMain() {
        IrUnit unit = new IrUnit("main.py", 4);
        unit.require(IrDependency.IOSTREAM);
        unit.require(IrDependency.STRING);
        IrFunction greet = IrFunction.free("greet", 1, 2);
        greet.addFragment(new IrFragment(2, 2, 20, "    std::cout << \"hi\" << std::endl;"));
        unit.registerFunction(greet);
        unit.entryFunction().addFragment(new IrFragment(4, 4, 7, "    greet();"));

        assertThat(renderer.render(unit)).isEqualTo("#include <iostream>\n"
                + "#include <string>\n"
                + "\n"
                + "void greet();\n"
                + "\n"
                + "int main(int argc, char **argv) {\n"
                + "    greet();\n"
                + "    return 0;\n"
                + "}\n"
                + "\n"
                + "void greet() {\n"
                + "    std::cout << \"hi\" << std::endl;\n"
                + "}\n");
    }

    @Test
    @Tag("unit")
    void testClassWithBasesAttributesAndCollections() {
        IrUnit unit = new IrUnit("shapes.py", 3);
        IrClass shape = new IrClass("Shape", 1, 1, List.of());
        IrClass square = new IrClass("Square", 2, 3, List.of("Shape"));
        square.addAttribute(new IrVariable("side", 3, new TypeSlot(TypeTag.FLOAT), "Square"));
        square.collections().put(new IrVector("corners", 3, TypeSlot.fixed(TypeTag.INT)));
        unit.registerClass(shape);
        unit.registerClass(square);

        String cpp = renderer.render(unit);

        assertThat(cpp).startsWith("class Shape;\nclass Square;\n\n");
        assertThat(cpp).contains("class Shape {\npublic:\n};\n");
        assertThat(cpp).contains("class Square : public Shape {\n"
                + "public:\n"
                + "    double side;\n"
                + "    std::vector<int> corners;\n"
                + "};\n");
    }

    @Test
    @Tag("unit")
    void testCommentIsAppendedToFirstLineAndEmptyFragmentsAreSkipped() {
        IrUnit unit = new IrUnit("c.py", 3);
        IrFragment loop = new IrFragment(1, 2, 9, "    while (true) {");
        loop.setComment("forever");
        loop.appendLine("    }");
        unit.entryFunction().addFragment(loop);
        unit.entryFunction().addFragment(new IrFragment(3, 3, 4, ""));

        assertThat(renderer.render(unit)).isEqualTo("int main(int argc, char **argv) {\n"
                + "    while (true) { // forever\n"
                + "    }\n"
                + "    return 0;\n"
                + "}\n");
    }
}
