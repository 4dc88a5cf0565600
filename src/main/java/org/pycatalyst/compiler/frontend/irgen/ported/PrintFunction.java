package org.pycatalyst.compiler.frontend.irgen.ported;

import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.irgen.TypedFragment;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrDependency;
import org.pycatalyst.compiler.ir.IrUnit;

import java.util.List;

/**
 * {@code print(a, b)} streams the arguments, separated by a space, and ends the line.
 */
public final class PrintFunction implements IPortedFunction {

	@Override
	public String name() {
		return "print";
	}

	@Override
	public TypedFragment translate(List<TypedFragment> args, IrUnit unit) throws NotTranslatableException {
		StringBuilder sb = new StringBuilder("std::cout");
		for (int i = 0; i < args.size(); i++) {
			TypedFragment arg = args.get(i);
			if (arg.isCollection()) {
				throw new NotTranslatableException("printing collections not supported");
			}
			if (arg.type() == TypeTag.VOID) {
				throw new NotTranslatableException("printing a call without return value not supported");
			}
			if (i > 0) {
				sb.append(" << \" \"");
			}
			sb.append(" << ").append(arg.code());
		}
		sb.append(" << std::endl");
		unit.require(IrDependency.IOSTREAM);
		return TypedFragment.of(sb.toString(), TypeTag.VOID);
	}
}
