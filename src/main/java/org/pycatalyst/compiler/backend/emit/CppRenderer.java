package org.pycatalyst.compiler.backend.emit;

import org.pycatalyst.compiler.api.TranslatorOptions;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrClass;
import org.pycatalyst.compiler.ir.IrCollection;
import org.pycatalyst.compiler.ir.IrDependency;
import org.pycatalyst.compiler.ir.IrFragment;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrUnit;
import org.pycatalyst.compiler.ir.IrVariable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an {@link IrUnit} as one C++ source file.
 * <p>
 * The layout is: includes, class forward declarations, free function prototypes, class
 * definitions with inline methods, then the entry function as {@code main} followed by the
 * free function definitions.
 */
public class CppRenderer {

    private final String indentUnit;

    public CppRenderer(TranslatorOptions options) {
        this.indentUnit = options.indentUnit();
    }

    /**
     * Renders the unit.
     * @param unit The translated unit.
     * @return The C++ source text, ending with a newline.
     */
    public String render(IrUnit unit) {
        StringBuilder out = new StringBuilder();
        for (IrDependency dependency : unit.dependencies()) {
            out.append("#include <").append(dependency.header()).append(">\n");
        }
        if (!unit.dependencies().isEmpty()) {
            out.append('\n');
        }

        if (!unit.classes().isEmpty()) {
            for (IrClass irClass : unit.classes().values()) {
                out.append("class ").append(irClass.name()).append(";\n");
            }
            out.append('\n');
        }

        List<IrFunction> freeFunctions = unit.freeFunctions();
        if (!freeFunctions.isEmpty()) {
            for (IrFunction function : freeFunctions) {
                out.append(signature(function, true)).append(";\n");
            }
            out.append('\n');
        }

        for (IrClass irClass : unit.classes().values()) {
            renderClass(irClass, out);
            out.append('\n');
        }

        renderFunction(unit.entryFunction(), "int main(int argc, char **argv)", "", out);
        for (IrFunction function : freeFunctions) {
            out.append('\n');
            renderFunction(function, signature(function, false), "", out);
        }
        return out.toString();
    }

    private void renderClass(IrClass irClass, StringBuilder out) {
        out.append("class ").append(irClass.name());
        if (!irClass.bases().isEmpty()) {
            out.append(irClass.bases().stream().map(b -> "public " + b).collect(Collectors.joining(", ", " : ", "")));
        }
        out.append(" {\npublic:\n");
        for (IrVariable attribute : irClass.attributes().values()) {
            out.append(indentUnit).append(attribute.type().get().cppName()).append(' ').append(attribute.name()).append(";\n");
        }
        for (IrCollection collection : irClass.collections().all()) {
            out.append(indentUnit).append(collection.cppType()).append(' ').append(collection.name()).append(";\n");
        }
        for (IrFunction method : irClass.methods().values()) {
            out.append('\n');
            renderFunction(method, signature(method, false), indentUnit, out);
        }
        out.append("};\n");
    }

    private void renderFunction(IrFunction function, String signature, String outer, StringBuilder out) {
        out.append(outer).append(signature).append(" {\n");
        for (IrFragment fragment : function.fragments()) {
            if (fragment.text().isEmpty()) {
                continue;
            }
            String[] lines = fragment.text().split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                out.append(lines[i].isEmpty() ? "" : outer + lines[i]);
                if (i == 0 && fragment.comment() != null) {
                    out.append(" // ").append(fragment.comment());
                }
                out.append('\n');
            }
        }
        if (function.isEntry()) {
            out.append(outer).append(indentUnit).append("return 0;\n");
        }
        out.append(outer).append("}\n");
    }

    /**
     * @param function A free function or method.
     * @param withDefaults Whether parameter defaults are spelled (prototypes only).
     * @return The C++ signature; constructors carry the class name and no return type.
     */
    String signature(IrFunction function, boolean withDefaults) {
        String parameters = function.parameters().values().stream()
                .map(p -> p.type().get().cppName() + " " + p.name() + (withDefaults && p.hasDefault() ? " = " + p.defaultLiteral() : ""))
                .collect(Collectors.joining(", ", "(", ")"));
        if (function.isConstructor()) {
            return function.ownerClass().orElseThrow() + parameters;
        }
        TypeTag returnType = function.returnType().get();
        return returnType.cppName() + " " + function.name() + parameters;
    }
}
