package org.pycatalyst.compiler.frontend.irgen.ported;

import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.irgen.TypedFragment;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrUnit;

import java.util.List;

/**
 * {@code len(x)}: the length of a string, the arity of a tuple, otherwise the container size.
 */
public final class LenFunction implements IPortedFunction {

	@Override
	public String name() {
		return "len";
	}

	@Override
	public TypedFragment translate(List<TypedFragment> args, IrUnit unit) throws NotTranslatableException {
		PortedFunctions.requireArity(name(), args, 1, 1);
		TypedFragment arg = args.get(0);
		switch (arg.type()) {
			case STR:
				return TypedFragment.of(arg.code() + ".length()", TypeTag.INT);
			case TUPLE:
				return TypedFragment.of("std::tuple_size<decltype(" + arg.code() + ")>::value", TypeTag.INT);
			case LIST:
			case SET:
			case AUTO:
				return TypedFragment.of(arg.code() + ".size()", TypeTag.INT);
			default:
				throw new NotTranslatableException("len() of a " + arg.type() + " value not supported");
		}
	}
}
