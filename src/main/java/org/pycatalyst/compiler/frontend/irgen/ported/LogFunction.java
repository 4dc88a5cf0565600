package org.pycatalyst.compiler.frontend.irgen.ported;

import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.irgen.TypedFragment;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrDependency;
import org.pycatalyst.compiler.ir.IrUnit;

import java.util.List;

/**
 * {@code log(x)} is the natural logarithm, {@code log(x, 10)} the decimal one and any other
 * base divides two natural logarithms.
 */
public final class LogFunction implements IPortedFunction {

	@Override
	public String name() {
		return "log";
	}

	@Override
	public TypedFragment translate(List<TypedFragment> args, IrUnit unit) throws NotTranslatableException {
		PortedFunctions.requireArity(name(), args, 1, 2);
		PortedFunctions.requireNumeric(name(), args);
		unit.require(IrDependency.MATH);
		String x = args.get(0).code();
		if (args.size() == 1) {
			return TypedFragment.of("std::log(" + x + ")", TypeTag.FLOAT);
		}
		String base = args.get(1).code();
		if ("10".equals(base)) {
			return TypedFragment.of("std::log10(" + x + ")", TypeTag.FLOAT);
		}
		return TypedFragment.of("(std::log(" + x + ") / std::log(" + base + "))", TypeTag.FLOAT);
	}
}
