package org.pycatalyst.compiler.ir;

import org.pycatalyst.compiler.frontend.semantics.TypeTag;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A fixed-arity tuple with one static type per slot, rendered as {@code std::tuple}.
 *
 * @param name The collection name.
 * @param line The creating line.
 * @param elementTypes The per-slot types; the arity never changes.
 */
public record IrTuple(String name, int line, List<TypeTag> elementTypes) implements IrCollection {

    public IrTuple {
        elementTypes = List.copyOf(elementTypes);
    }

    /**
     * @return The number of slots.
     */
    public int arity() {
        return elementTypes.size();
    }

    @Override
    public TypeTag kind() {
        return TypeTag.TUPLE;
    }

    @Override
    public String cppType() {
        return elementTypes.stream()
                .map(TypeTag::cppName)
                .collect(Collectors.joining(", ", "std::tuple<", ">"));
    }

    @Override
    public IrDependency dependency() {
        return IrDependency.TUPLE;
    }
}
