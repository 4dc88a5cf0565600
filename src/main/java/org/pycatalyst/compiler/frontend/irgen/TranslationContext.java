package org.pycatalyst.compiler.frontend.irgen;

import org.pycatalyst.compiler.api.TranslatorOptions;
import org.pycatalyst.compiler.diagnostics.CompilerLogger;
import org.pycatalyst.compiler.diagnostics.DiagnosticsEngine;
import org.pycatalyst.compiler.frontend.irgen.ported.PortedFunctionRegistry;
import org.pycatalyst.compiler.frontend.parser.ast.AstNode;
import org.pycatalyst.compiler.frontend.parser.ast.StatementNode;
import org.pycatalyst.compiler.frontend.semantics.SymbolResolver;
import org.pycatalyst.compiler.ir.IrDependency;
import org.pycatalyst.compiler.ir.IrFragment;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrUnit;
import org.pycatalyst.compiler.ir.IrVariable;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable context passed to statement handlers while one function body is translated.
 * Provides emission utilities, the expression translator, indentation and diagnostics access.
 */
public final class TranslationContext {

	private final IrUnit unit;
	private final IrFunction function;
	private final SymbolResolver resolver;
	private final StatementHandlerRegistry registry;
	private final ExpressionTranslator expressions;
	private final TranslatorOptions options;
	private final DiagnosticsEngine diagnostics;
	private final String fileName;
	private final List<String> sourceLines;
	private int depth = 1;
	private StatementNode leadingStatement;

	/**
	 * Constructs a new translation context for one function.
	 * @param unit The unit being built.
	 * @param function The function whose body is translated.
	 * @param registry The registry for resolving statement handlers.
	 * @param ported The registry of ported library functions.
	 * @param options The translator options.
	 * @param diagnostics The diagnostics engine for warnings.
	 * @param fileName The source file name, for diagnostics.
	 * @param sourceLines The raw source lines.
	 */
	public TranslationContext(IrUnit unit, IrFunction function, StatementHandlerRegistry registry,
							  PortedFunctionRegistry ported, TranslatorOptions options, DiagnosticsEngine diagnostics,
							  String fileName, List<String> sourceLines) {
		this.unit = unit;
		this.function = function;
		this.resolver = new SymbolResolver(unit, function);
		this.registry = registry;
		this.expressions = new ExpressionTranslator(resolver, ported);
		this.options = options;
		this.diagnostics = diagnostics;
		this.fileName = fileName;
		this.sourceLines = sourceLines;
	}

	public IrUnit unit() {
		return unit;
	}

	public IrFunction function() {
		return function;
	}

	public SymbolResolver resolver() {
		return resolver;
	}

	public ExpressionTranslator expressions() {
		return expressions;
	}

	public DiagnosticsEngine diagnostics() {
		return diagnostics;
	}

	public List<String> sourceLines() {
		return sourceLines;
	}

	/**
	 * Emits a fragment into the current function.
	 * @param fragment The fragment.
	 */
	public void emit(IrFragment fragment) {
		function.addFragment(fragment);
	}

	/**
	 * Emits a single line of translated code for a node.
	 * @param node The node the code stands for.
	 * @param code The unindented code.
	 */
	public void emitLine(AstNode node, String code) {
		emit(new IrFragment(node.line(), node.endLine(), node.span().endColumn(), indent() + code));
	}

	/**
	 * @param dependency A header the generated code needs.
	 */
	public void require(IrDependency dependency) {
		unit.require(dependency);
	}

	/**
	 * @return The indentation of the current block level.
	 */
	public String indent() {
		return options.indentUnit().repeat(depth);
	}

	/**
	 * Translates a statement; a refused statement is passed through instead.
	 * @param node The statement.
	 */
	public void translate(StatementNode node) {
		try {
			registry.resolve(node).translate(node, this);
		} catch (NotTranslatableException e) {
			passThrough(node, e.getReason());
		}
	}

	/**
	 * Translates a function or module body.
	 * @param body The statements to translate.
	 * @param leading The first statement of the body in the source, the only one that can be
	 *                its docstring; {@code null} if there is none.
	 */
	public void translateBody(List<StatementNode> body, StatementNode leading) {
		leadingStatement = leading;
		for (StatementNode statement : body) {
			translate(statement);
		}
	}

	/**
	 * @param node A statement.
	 * @return {@code true} if the statement opens the body being translated.
	 */
	public boolean isLeadingStatement(StatementNode node) {
		return node != null && node == leadingStatement;
	}

	/**
	 * Translates the statements of a nested block one level deeper.
	 * @param body The block.
	 */
	public void translateBlock(List<StatementNode> body) {
		translateBlock(body, null);
	}

	/**
	 * Translates the statements of a nested block one level deeper. Locals and collections
	 * first declared inside the block go out of scope when it closes, as they do in the
	 * generated code.
	 * @param body The block.
	 * @param headerVariable A variable declared by the block header, such as a loop counter, or {@code null}.
	 */
	public void translateBlock(List<StatementNode> body, IrVariable headerVariable) {
		Set<String> locals = new HashSet<>(function.locals().keySet());
		Set<String> collections = function.collections().names();
		if (headerVariable != null) {
			function.declareLocal(headerVariable);
		}
		depth++;
		try {
			for (StatementNode statement : body) {
				translate(statement);
			}
		} finally {
			depth--;
			function.retainLocals(locals);
			function.collections().retain(collections);
		}
	}

	/**
	 * Appends a block closer at the current level to the last fragment emitted up to a line.
	 * @param lastLine The last line of the block.
	 */
	public void closeBlock(int lastLine) {
		IrFragment last = function.lastFragmentUpTo(lastLine)
				.orElseThrow(() -> new IllegalStateException("No fragment to close block ending at line " + lastLine));
		last.appendLine(indent() + "}");
	}

	/**
	 * Emits a statement verbatim as inert text, annotated with the reason it was refused.
	 * @param node The refused statement.
	 * @param reason Why it was refused.
	 */
	public void passThrough(AstNode node, String reason) {
		emit(IrFragment.passThrough(node.line(), node.endLine(), PassThrough.render(sourceLines, node.line(), node.endLine(), reason, indent()), reason));
		diagnostics.reportWarning("Passed through: " + reason, fileName, node.line());
		CompilerLogger.passedThrough(function.qualifiedName(), node.line(), reason);
	}
}
