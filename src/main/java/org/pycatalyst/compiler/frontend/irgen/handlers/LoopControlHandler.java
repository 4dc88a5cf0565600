package org.pycatalyst.compiler.frontend.irgen.handlers;

import org.pycatalyst.compiler.frontend.irgen.IStatementHandler;
import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.irgen.TranslationContext;
import org.pycatalyst.compiler.frontend.parser.ast.BreakNode;
import org.pycatalyst.compiler.frontend.parser.ast.ContinueNode;
import org.pycatalyst.compiler.frontend.parser.ast.StatementNode;

/**
 * Translates {@code break} and {@code continue}.
 */
public final class LoopControlHandler implements IStatementHandler<StatementNode> {

	@Override
	public void translate(StatementNode node, TranslationContext ctx) throws NotTranslatableException {
		if (node instanceof BreakNode) {
			ctx.emitLine(node, "break;");
		} else if (node instanceof ContinueNode) {
			ctx.emitLine(node, "continue;");
		} else {
			throw new NotTranslatableException("unsupported loop control statement");
		}
	}
}
