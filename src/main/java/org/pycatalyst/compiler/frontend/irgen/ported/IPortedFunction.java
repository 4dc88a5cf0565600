package org.pycatalyst.compiler.frontend.irgen.ported;

import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.irgen.TypedFragment;
import org.pycatalyst.compiler.ir.IrUnit;

import java.util.List;

/**
 * A library function of the source language with a fixed C++ expansion.
 */
public interface IPortedFunction {

	/**
	 * @return The name the function is called by in the source.
	 */
	String name();

	/**
	 * Expands a call.
	 *
	 * @param args The already translated arguments.
	 * @param unit The unit, for recording the headers the expansion needs.
	 * @return The expansion and its type.
	 * @throws NotTranslatableException if the arity or argument types are not supported.
	 */
	TypedFragment translate(List<TypedFragment> args, IrUnit unit) throws NotTranslatableException;
}
