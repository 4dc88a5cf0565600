package org.pycatalyst.compiler.frontend.irgen.handlers;

import org.pycatalyst.compiler.frontend.irgen.IStatementHandler;
import org.pycatalyst.compiler.frontend.irgen.TranslationContext;
import org.pycatalyst.compiler.frontend.parser.ast.PassNode;
import org.pycatalyst.compiler.ir.IrFragment;

/**
 * Emits an empty fragment for {@code pass}, which still anchors a block closer.
 */
public final class PassStatementHandler implements IStatementHandler<PassNode> {

	@Override
	public void translate(PassNode node, TranslationContext ctx) {
		ctx.emit(new IrFragment(node.line(), node.endLine(), node.span().endColumn(), ""));
	}
}
