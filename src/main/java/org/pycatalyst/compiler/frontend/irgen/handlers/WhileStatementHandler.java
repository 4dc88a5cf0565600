package org.pycatalyst.compiler.frontend.irgen.handlers;

import org.pycatalyst.compiler.frontend.irgen.ExpressionTranslator;
import org.pycatalyst.compiler.frontend.irgen.IStatementHandler;
import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.irgen.TranslationContext;
import org.pycatalyst.compiler.frontend.parser.ast.WhileNode;
import org.pycatalyst.compiler.ir.IrFragment;

/**
 * Translates {@code while} loops; loops with an {@code else} clause are refused.
 */
public final class WhileStatementHandler implements IStatementHandler<WhileNode> {

	@Override
	public void translate(WhileNode node, TranslationContext ctx) throws NotTranslatableException {
		if (!node.orElse().isEmpty()) {
			throw new NotTranslatableException("while-else not supported");
		}
		String condition = ExpressionTranslator.unwrap(ctx.expressions().translateScalar(node.test(), "conditions").code());
		ctx.emit(new IrFragment(node.line(), node.test().endLine(), node.test().span().endColumn(),
				ctx.indent() + "while (" + condition + ") {"));
		ctx.translateBlock(node.body());
		ctx.closeBlock(node.endLine());
	}
}
