package org.pycatalyst.compiler.frontend.irgen.handlers;

import org.pycatalyst.compiler.frontend.irgen.IStatementHandler;
import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.irgen.TranslationContext;
import org.pycatalyst.compiler.frontend.parser.ast.ClassDefNode;
import org.pycatalyst.compiler.frontend.parser.ast.StatementNode;

/**
 * Refuses {@code def} and {@code class} inside a body. Top-level definitions and methods are
 * registered by the signature collectors and never reach a statement handler.
 */
public final class NestedDefinitionHandler implements IStatementHandler<StatementNode> {

	@Override
	public void translate(StatementNode node, TranslationContext ctx) throws NotTranslatableException {
		String kind = node instanceof ClassDefNode ? "class" : "function";
		throw new NotTranslatableException("nested " + kind + " definitions not supported");
	}
}
