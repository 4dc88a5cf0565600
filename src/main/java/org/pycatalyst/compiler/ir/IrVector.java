package org.pycatalyst.compiler.ir;

import org.pycatalyst.compiler.frontend.semantics.TypeSlot;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;

import java.util.List;

/**
 * A homogeneous list, rendered as {@code std::vector}.
 *
 * @param name The collection name.
 * @param line The creating line.
 * @param elementType The fixed element type.
 */
public record IrVector(String name, int line, TypeSlot elementType) implements IrCollection {

    public IrVector {
        if (!elementType.isFixed()) {
            throw new IllegalArgumentException("Element type of vector '" + name + "' must be fixed");
        }
    }

    @Override
    public TypeTag kind() {
        return TypeTag.LIST;
    }

    @Override
    public List<TypeTag> elementTypes() {
        return List.of(elementType.get());
    }

    @Override
    public String cppType() {
        return "std::vector<" + elementType.get().cppName() + ">";
    }

    @Override
    public IrDependency dependency() {
        return IrDependency.VECTOR;
    }
}
