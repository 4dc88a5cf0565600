package org.pycatalyst.compiler.frontend.irgen;

import org.pycatalyst.compiler.frontend.parser.ast.StatementNode;

/**
 * Default/fallback handler used when no specific handler is registered.
 * It refuses every statement, so the statement is passed through verbatim.
 */
public final class PassThroughHandler implements IStatementHandler<StatementNode> {

	@Override
	public void translate(StatementNode node, TranslationContext ctx) throws NotTranslatableException {
		throw new NotTranslatableException("unsupported statement: " + describe(node));
	}

	/**
	 * @param node A statement.
	 * @return A readable statement kind, e.g. {@code AugAssign}.
	 */
	static String describe(StatementNode node) {
		String name = node.getClass().getSimpleName();
		return name.endsWith("Node") ? name.substring(0, name.length() - "Node".length()) : name;
	}
}
