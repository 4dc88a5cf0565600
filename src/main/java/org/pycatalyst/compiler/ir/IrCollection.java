package org.pycatalyst.compiler.ir;

import org.pycatalyst.compiler.frontend.semantics.TypeTag;

import java.util.List;

/**
 * Common view on the three collection kinds.
 */
public interface IrCollection extends IrSymbol {

    /**
     * @return {@link TypeTag#LIST}, {@link TypeTag#TUPLE} or {@link TypeTag#SET}.
     */
    TypeTag kind();

    /**
     * @return The element types: one entry for homogeneous collections, one per slot for tuples.
     */
    List<TypeTag> elementTypes();

    /**
     * @return The full C++ type, e.g. {@code std::vector<int>}.
     */
    String cppType();

    /**
     * @return The dependency the C++ type needs.
     */
    IrDependency dependency();

    @Override
    default TypeTag expressionType() {
        return kind();
    }
}
