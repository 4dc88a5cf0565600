package org.pycatalyst.compiler.ir;

import org.pycatalyst.compiler.frontend.semantics.TypeTag;

/**
 * Marker interface for every named entity a scope can resolve: variables and the three
 * collection kinds.
 */
public interface IrSymbol {

    /**
     * @return The name of the symbol in the source.
     */
    String name();

    /**
     * @return The source line of the declaration, or -1 for synthetic symbols.
     */
    int line();

    /**
     * @return The type an expression naming this symbol has.
     */
    TypeTag expressionType();
}
