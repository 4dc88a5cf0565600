package org.pycatalyst.compiler.frontend.irgen.handlers;

import org.pycatalyst.compiler.frontend.irgen.ExpressionTranslator;
import org.pycatalyst.compiler.frontend.irgen.IStatementHandler;
import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.irgen.TranslationContext;
import org.pycatalyst.compiler.frontend.parser.ast.IfNode;
import org.pycatalyst.compiler.frontend.parser.ast.StatementNode;
import org.pycatalyst.compiler.ir.IrFragment;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates {@code if}/{@code elif}/{@code else} chains.
 * <p>
 * All conditions of the chain are translated before anything is emitted, so one refused
 * condition passes the whole chain through.
 */
public final class IfStatementHandler implements IStatementHandler<IfNode> {

	private static final String ELSE_KEYWORD = "else";

	@Override
	public void translate(IfNode node, TranslationContext ctx) throws NotTranslatableException {
		List<IfNode> chain = new ArrayList<>();
		chain.add(node);
		IfNode last = node;
		while (isElifContinuation(last)) {
			last = (IfNode) last.orElse().get(0);
			chain.add(last);
		}
		List<String> conditions = new ArrayList<>();
		for (IfNode branch : chain) {
			conditions.add(ExpressionTranslator.unwrap(ctx.expressions().translateScalar(branch.test(), "conditions").code()));
		}
		int elseLine = last.orElse().isEmpty() ? 0 : locateElse(last, ctx.sourceLines());

		for (int i = 0; i < chain.size(); i++) {
			IfNode branch = chain.get(i);
			String introducer = i == 0 ? "if (" : "} else if (";
			ctx.emit(new IrFragment(branch.line(), branch.test().endLine(), branch.test().span().endColumn(),
					ctx.indent() + introducer + conditions.get(i) + ") {"));
			ctx.translateBlock(branch.body());
		}
		if (elseLine > 0) {
			String source = ctx.sourceLines().get(elseLine - 1);
			int endColumn = source.indexOf(ELSE_KEYWORD) + ELSE_KEYWORD.length();
			ctx.emit(new IrFragment(elseLine, elseLine, endColumn, ctx.indent() + "} else {"));
			ctx.translateBlock(last.orElse());
		}
		ctx.closeBlock(node.endLine());
	}

	private static boolean isElifContinuation(IfNode node) {
		return node.orElse().size() == 1 && node.orElse().get(0) instanceof IfNode next && next.elif();
	}

	/**
	 * Finds the line of the {@code else} keyword. Trees without a recorded else line fall back
	 * to scanning backward from the first statement of the else block, skipping blank and
	 * comment-only lines.
	 */
	static int locateElse(IfNode node, List<String> sourceLines) throws NotTranslatableException {
		if (node.elseLine() > 0) {
			return node.elseLine();
		}
		StatementNode first = node.orElse().get(0);
		for (int line = first.line(); line > node.line(); line--) {
			String text = sourceLines.get(line - 1).strip();
			if (text.startsWith(ELSE_KEYWORD) && (text.length() == ELSE_KEYWORD.length()
					|| !Character.isJavaIdentifierPart(text.charAt(ELSE_KEYWORD.length())))) {
				return line;
			}
			if (line != first.line() && !text.isEmpty() && !text.startsWith("#")) {
				break;
			}
		}
		throw new NotTranslatableException("else branch could not be located");
	}
}
