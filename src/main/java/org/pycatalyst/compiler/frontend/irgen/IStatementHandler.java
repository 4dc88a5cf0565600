package org.pycatalyst.compiler.frontend.irgen;

import org.pycatalyst.compiler.frontend.parser.ast.StatementNode;

/**
 * Translates a specific statement type into code fragments.
 * <p>
 * Implementations should be stateless. All output must be emitted via the provided
 * {@link TranslationContext}, and nothing may be emitted before the handler knows the statement
 * can be translated: a handler that throws leaves no fragments behind.
 *
 * @param <T> The concrete statement type handled by this handler.
 */
public interface IStatementHandler<T extends StatementNode> {

	/**
	 * Translates the statement and emits the result via the context.
	 *
	 * @param node The statement.
	 * @param ctx The translation context of the enclosing function.
	 * @throws NotTranslatableException if the statement must be passed through.
	 */
	void translate(T node, TranslationContext ctx) throws NotTranslatableException;
}
