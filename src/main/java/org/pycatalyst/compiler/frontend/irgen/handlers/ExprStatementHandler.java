package org.pycatalyst.compiler.frontend.irgen.handlers;

import org.pycatalyst.compiler.frontend.irgen.IStatementHandler;
import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.irgen.TranslationContext;
import org.pycatalyst.compiler.frontend.parser.ast.CallNode;
import org.pycatalyst.compiler.frontend.parser.ast.ConstantKind;
import org.pycatalyst.compiler.frontend.parser.ast.ConstantNode;
import org.pycatalyst.compiler.frontend.parser.ast.ExprStatementNode;
import org.pycatalyst.compiler.ir.IrFragment;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates expression statements: calls, and docstrings which become block comments. Only a
 * string literal opening a module or function body is a docstring.
 */
public final class ExprStatementHandler implements IStatementHandler<ExprStatementNode> {

	@Override
	public void translate(ExprStatementNode node, TranslationContext ctx) throws NotTranslatableException {
		if (node.value() instanceof CallNode call) {
			ctx.emitLine(node, ctx.expressions().translate(call).code() + ";");
			return;
		}
		if (node.value() instanceof ConstantNode c && c.kind() == ConstantKind.STR
				&& ctx.isLeadingStatement(node)) {
			ctx.emit(new IrFragment(node.line(), node.endLine(), node.span().endColumn(),
					blockComment((String) c.value(), ctx.indent())));
			return;
		}
		throw new NotTranslatableException("expression statement has no effect");
	}

	/**
	 * Renders a docstring as a C++ block comment, removing the common indentation of its
	 * continuation lines.
	 */
	static String blockComment(String doc, String indent) {
		List<String> lines = dedent(doc.split("\n", -1));
		StringBuilder sb = new StringBuilder(indent).append("/*");
		for (String line : lines) {
			sb.append('\n');
			String escaped = line.replace("*/", "* /").stripTrailing();
			if (!escaped.isEmpty()) {
				sb.append(indent).append(escaped);
			}
		}
		return sb.append('\n').append(indent).append("*/").toString();
	}

	private static List<String> dedent(String[] raw) {
		int margin = Integer.MAX_VALUE;
		for (int i = 1; i < raw.length; i++) {
			String line = raw[i];
			if (!line.isBlank()) {
				margin = Math.min(margin, line.length() - line.stripLeading().length());
			}
		}
		List<String> lines = new ArrayList<>();
		for (int i = 0; i < raw.length; i++) {
			String line = raw[i];
			if (i == 0) {
				lines.add(line.strip());
			} else {
				lines.add(line.isBlank() ? "" : line.substring(Math.min(margin, line.length())));
			}
		}
		while (!lines.isEmpty() && lines.get(0).isEmpty()) {
			lines.remove(0);
		}
		while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
			lines.remove(lines.size() - 1);
		}
		return lines;
	}
}
