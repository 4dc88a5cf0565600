package org.pycatalyst.compiler.frontend.irgen.ported;

import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.irgen.TypedFragment;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrDependency;
import org.pycatalyst.compiler.ir.IrUnit;

import java.util.List;

public final class PowFunction implements IPortedFunction {

	@Override
	public String name() {
		return "pow";
	}

	@Override
	public TypedFragment translate(List<TypedFragment> args, IrUnit unit) throws NotTranslatableException {
		PortedFunctions.requireArity(name(), args, 2, 2);
		PortedFunctions.requireNumeric(name(), args);
		unit.require(IrDependency.MATH);
		return TypedFragment.of("std::pow(" + args.get(0).code() + ", " + args.get(1).code() + ")", TypeTag.FLOAT);
	}
}
