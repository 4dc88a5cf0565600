package org.pycatalyst.compiler.frontend.irgen.ported;

import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.irgen.TypedFragment;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;

import java.util.List;

/**
 * Argument checks shared by the ported functions.
 */
final class PortedFunctions {

	private PortedFunctions() {}

	static void requireArity(String name, List<TypedFragment> args, int min, int max) throws NotTranslatableException {
		if (args.size() < min || args.size() > max) {
			String expected = min == max ? Integer.toString(min) : min + " to " + max;
			throw new NotTranslatableException(name + "() expects " + expected + " arguments, got " + args.size());
		}
	}

	static void requireNumeric(String name, List<TypedFragment> args) throws NotTranslatableException {
		for (TypedFragment arg : args) {
			if (!arg.type().isNumeric() && arg.type() != TypeTag.AUTO) {
				throw new NotTranslatableException(name + "() of a " + arg.type() + " value not supported");
			}
		}
	}
}
