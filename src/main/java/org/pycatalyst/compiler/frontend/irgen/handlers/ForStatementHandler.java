package org.pycatalyst.compiler.frontend.irgen.handlers;

import org.pycatalyst.compiler.frontend.irgen.ExpressionTranslator;
import org.pycatalyst.compiler.frontend.irgen.IStatementHandler;
import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.irgen.TranslationContext;
import org.pycatalyst.compiler.frontend.irgen.TypedFragment;
import org.pycatalyst.compiler.frontend.parser.ast.CallNode;
import org.pycatalyst.compiler.frontend.parser.ast.ConstantKind;
import org.pycatalyst.compiler.frontend.parser.ast.ConstantNode;
import org.pycatalyst.compiler.frontend.parser.ast.ExpressionNode;
import org.pycatalyst.compiler.frontend.parser.ast.ForNode;
import org.pycatalyst.compiler.frontend.parser.ast.NameNode;
import org.pycatalyst.compiler.frontend.parser.ast.UnaryOpNode;
import org.pycatalyst.compiler.frontend.parser.ast.UnaryOperator;
import org.pycatalyst.compiler.frontend.semantics.TypeSlot;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrFragment;
import org.pycatalyst.compiler.ir.IrVariable;

import java.util.List;

/**
 * Translates counting loops over {@code range(...)} or a non-negative integer literal into a
 * C++ {@code for} header.
 */
public final class ForStatementHandler implements IStatementHandler<ForNode> {

	private static final String RANGE = "range";

	@Override
	public void translate(ForNode node, TranslationContext ctx) throws NotTranslatableException {
		if (!node.orElse().isEmpty()) {
			throw new NotTranslatableException("for-else not supported");
		}
		if (!(node.target() instanceof NameNode target)) {
			throw new NotTranslatableException("only a single loop variable supported");
		}
		String var = target.id();
		Bounds bounds = bounds(node.iter(), ctx);

		if (ctx.function().collections().get(var).isPresent()) {
			throw new NotTranslatableException("loop variable '" + var + "' is a collection");
		}
		if (ctx.resolver().resolveAssignable(var).isPresent()) {
			throw new NotTranslatableException("loop variable '" + var + "' is already declared");
		}
		String comparison = bounds.step() > 0 ? " < " : " > ";
		String header = "for (int " + var + " = " + bounds.start() + "; " + var + comparison + bounds.stop() + "; "
				+ increment(var, bounds.step()) + ") {";
		ctx.emit(new IrFragment(node.line(), node.iter().endLine(), node.iter().span().endColumn(), ctx.indent() + header));
		IrVariable counter = new IrVariable(var, node.line(), new TypeSlot(TypeTag.INT), ctx.function().qualifiedName());
		ctx.translateBlock(node.body(), counter);
		ctx.closeBlock(node.endLine());
	}

	private record Bounds(String start, String stop, long step) {}

	private static Bounds bounds(ExpressionNode iter, TranslationContext ctx) throws NotTranslatableException {
		if (iter instanceof ConstantNode c && c.kind() == ConstantKind.INT) {
			int count = ExpressionTranslator.intLiteral(c, false);
			if (count >= 0) {
				return new Bounds("0", Integer.toString(count), 1);
			}
		}
		if (!(iter instanceof CallNode call) || !(call.func() instanceof NameNode callee) || !RANGE.equals(callee.id())) {
			throw new NotTranslatableException("only range() loops supported");
		}
		List<ExpressionNode> args = call.args();
		if (!call.keywords().isEmpty() || args.isEmpty() || args.size() > 3) {
			throw new NotTranslatableException("range() expects 1 to 3 arguments");
		}
		String[] codes = new String[args.size()];
		for (int i = 0; i < args.size(); i++) {
			TypedFragment arg = ctx.expressions().translateScalar(args.get(i), "range arguments");
			if (arg.type() != TypeTag.INT) {
				throw new NotTranslatableException("range() arguments must be int, got " + arg.type());
			}
			codes[i] = arg.code();
		}
		if (args.size() == 1) {
			return new Bounds("0", codes[0], 1);
		}
		long step = args.size() == 3 ? literalStep(args.get(2)) : 1;
		return new Bounds(codes[0], codes[1], step);
	}

	private static long literalStep(ExpressionNode node) throws NotTranslatableException {
		long step;
		if (node instanceof ConstantNode c && c.kind() == ConstantKind.INT) {
			step = ExpressionTranslator.intLiteral(c, false);
		} else if (node instanceof UnaryOpNode u && u.op() == UnaryOperator.USUB
				&& u.operand() instanceof ConstantNode c && c.kind() == ConstantKind.INT) {
			step = ExpressionTranslator.intLiteral(c, true);
		} else {
			throw new NotTranslatableException("range() step must be an integer literal");
		}
		if (step == 0) {
			throw new NotTranslatableException("range() step must not be zero");
		}
		return step;
	}

	private static String increment(String var, long step) {
		if (step == 1) return var + "++";
		if (step == -1) return var + "--";
		return step > 0 ? var + " += " + step : var + " -= " + (-step);
	}
}
