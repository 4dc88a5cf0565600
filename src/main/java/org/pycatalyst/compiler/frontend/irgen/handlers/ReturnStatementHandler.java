package org.pycatalyst.compiler.frontend.irgen.handlers;

import org.pycatalyst.compiler.frontend.irgen.IStatementHandler;
import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.irgen.TranslationContext;
import org.pycatalyst.compiler.frontend.irgen.TypedFragment;
import org.pycatalyst.compiler.frontend.parser.ast.ReturnNode;
import org.pycatalyst.compiler.ir.IrFunction;

/**
 * Translates {@code return}. A returned value is unified into the function's return type.
 */
public final class ReturnStatementHandler implements IStatementHandler<ReturnNode> {

	@Override
	public void translate(ReturnNode node, TranslationContext ctx) throws NotTranslatableException {
		IrFunction function = ctx.function();
		if (function.isEntry()) {
			throw new NotTranslatableException("return outside a function not supported");
		}
		if (node.value() == null) {
			ctx.emitLine(node, "return;");
			return;
		}
		if (function.isConstructor()) {
			throw new NotTranslatableException("returning a value from a constructor not supported");
		}
		TypedFragment value = ctx.expressions().translateScalar(node.value(), "return values");
		function.returnType().unify(value.type());
		ctx.emitLine(node, "return " + value.code() + ";");
	}
}
