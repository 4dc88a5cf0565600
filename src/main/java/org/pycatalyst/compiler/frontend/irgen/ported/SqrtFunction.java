package org.pycatalyst.compiler.frontend.irgen.ported;

import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.irgen.TypedFragment;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrDependency;
import org.pycatalyst.compiler.ir.IrUnit;

import java.util.List;

public final class SqrtFunction implements IPortedFunction {

	@Override
	public String name() {
		return "sqrt";
	}

	@Override
	public TypedFragment translate(List<TypedFragment> args, IrUnit unit) throws NotTranslatableException {
		PortedFunctions.requireArity(name(), args, 1, 1);
		PortedFunctions.requireNumeric(name(), args);
		unit.require(IrDependency.MATH);
		return TypedFragment.of("std::sqrt(" + args.get(0).code() + ")", TypeTag.FLOAT);
	}
}
