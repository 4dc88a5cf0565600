package org.pycatalyst.compiler.ir;

import org.pycatalyst.compiler.frontend.semantics.TypeSlot;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;

import java.util.List;

/**
 * A homogeneous set, rendered as {@code std::unordered_set}.
 *
 * @param name The collection name.
 * @param line The creating line.
 * @param elementType The fixed element type.
 */
public record IrSet(String name, int line, TypeSlot elementType) implements IrCollection {

    public IrSet {
        if (!elementType.isFixed()) {
            throw new IllegalArgumentException("Element type of set '" + name + "' must be fixed");
        }
    }

    @Override
    public TypeTag kind() {
        return TypeTag.SET;
    }

    @Override
    public List<TypeTag> elementTypes() {
        return List.of(elementType.get());
    }

    @Override
    public String cppType() {
        return "std::unordered_set<" + elementType.get().cppName() + ">";
    }

    @Override
    public IrDependency dependency() {
        return IrDependency.SET;
    }
}
