package org.pycatalyst.compiler.ir;

import org.pycatalyst.compiler.frontend.semantics.TypeSlot;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;

/**
 * A scalar variable, parameter or class attribute.
 *
 * @param name The variable name.
 * @param line The line of the first assignment (or of the owning declaration for parameters).
 * @param type The shared type slot, refined in place.
 * @param owner The qualified name of the owning function or class.
 * @param defaultLiteral The C++ spelling of a parameter default, or {@code null}.
 */
public record IrVariable(String name, int line, TypeSlot type, String owner, String defaultLiteral) implements IrSymbol {

    /**
     * Creates a variable without default value.
     * @param name The variable name.
     * @param line The declaration line.
     * @param type The type slot.
     * @param owner The owning scope.
     */
    public IrVariable(String name, int line, TypeSlot type, String owner) {
        this(name, line, type, owner, null);
    }

    /**
     * @return {@code true} if this is a parameter with a default value.
     */
    public boolean hasDefault() {
        return defaultLiteral != null;
    }

    @Override
    public TypeTag expressionType() {
        return type.get();
    }
}
