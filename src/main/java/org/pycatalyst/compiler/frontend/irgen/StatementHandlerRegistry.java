package org.pycatalyst.compiler.frontend.irgen;

import org.pycatalyst.compiler.frontend.irgen.handlers.AssignStatementHandler;
import org.pycatalyst.compiler.frontend.irgen.handlers.ExprStatementHandler;
import org.pycatalyst.compiler.frontend.irgen.handlers.ForStatementHandler;
import org.pycatalyst.compiler.frontend.irgen.handlers.IfStatementHandler;
import org.pycatalyst.compiler.frontend.irgen.handlers.LoopControlHandler;
import org.pycatalyst.compiler.frontend.irgen.handlers.NestedDefinitionHandler;
import org.pycatalyst.compiler.frontend.irgen.handlers.PassStatementHandler;
import org.pycatalyst.compiler.frontend.irgen.handlers.ReturnStatementHandler;
import org.pycatalyst.compiler.frontend.irgen.handlers.WhileStatementHandler;
import org.pycatalyst.compiler.frontend.parser.ast.AssignNode;
import org.pycatalyst.compiler.frontend.parser.ast.BreakNode;
import org.pycatalyst.compiler.frontend.parser.ast.ClassDefNode;
import org.pycatalyst.compiler.frontend.parser.ast.ContinueNode;
import org.pycatalyst.compiler.frontend.parser.ast.ExprStatementNode;
import org.pycatalyst.compiler.frontend.parser.ast.ForNode;
import org.pycatalyst.compiler.frontend.parser.ast.FunctionDefNode;
import org.pycatalyst.compiler.frontend.parser.ast.IfNode;
import org.pycatalyst.compiler.frontend.parser.ast.PassNode;
import org.pycatalyst.compiler.frontend.parser.ast.ReturnNode;
import org.pycatalyst.compiler.frontend.parser.ast.StatementNode;
import org.pycatalyst.compiler.frontend.parser.ast.WhileNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping statement classes to handler instances.
 * <p>
 * Provides explicit registration and a default handler fallback that passes the statement
 * through. The {@link #resolve(StatementNode)} method walks the class hierarchy to find the
 * nearest registered handler.
 */
public final class StatementHandlerRegistry {

	private final Map<Class<? extends StatementNode>, IStatementHandler<?>> byClass = new HashMap<>();
	private final IStatementHandler<StatementNode> defaultHandler;

	private StatementHandlerRegistry(IStatementHandler<StatementNode> defaultHandler) {
		this.defaultHandler = defaultHandler;
	}

	/**
	 * Registers a handler for the given statement class.
	 *
	 * @param nodeType The concrete statement class.
	 * @param handler The handler instance handling that class.
	 * @param <T> Concrete statement type parameter.
	 */
	public <T extends StatementNode> void register(Class<T> nodeType, IStatementHandler<? super T> handler) {
		byClass.put(nodeType, handler);
	}

	/**
	 * Retrieves the handler strictly registered for the given class (no hierarchy search).
	 *
	 * @param nodeType The statement class to look up.
	 * @return Optional handler if present.
	 */
	public Optional<IStatementHandler<?>> get(Class<? extends StatementNode> nodeType) {
		return Optional.ofNullable(byClass.get(nodeType));
	}

	/**
	 * Resolves a handler for the given node by searching the node's concrete class and then
	 * its superclasses. Falls back to the default handler.
	 *
	 * @param node The statement to resolve a handler for.
	 * @return A non-null handler.
	 */
	@SuppressWarnings("unchecked")
	public IStatementHandler<StatementNode> resolve(StatementNode node) {
		Class<?> c = node.getClass();
		while (c != null && StatementNode.class.isAssignableFrom(c)) {
			IStatementHandler<?> found = byClass.get(c);
			if (found != null) return (IStatementHandler<StatementNode>) found;
			c = c.getSuperclass();
		}
		return defaultHandler;
	}

	/**
	 * @return The fallback handler used when no specific handler is registered.
	 */
	public IStatementHandler<StatementNode> defaultHandler() {
		return defaultHandler;
	}

	/**
	 * Creates a registry with the given default handler and no other registrations.
	 *
	 * @param defaultHandler The fallback handler.
	 * @return A new registry instance.
	 */
	public static StatementHandlerRegistry initialize(IStatementHandler<StatementNode> defaultHandler) {
		return new StatementHandlerRegistry(defaultHandler);
	}

	/**
	 * Initializes a registry with the pass-through default and all built-in handlers.
	 *
	 * @return A registry pre-populated with the standard handlers.
	 */
	public static StatementHandlerRegistry initializeWithDefaults() {
		StatementHandlerRegistry reg = initialize(new PassThroughHandler());
		reg.register(AssignNode.class, new AssignStatementHandler());
		reg.register(IfNode.class, new IfStatementHandler());
		reg.register(WhileNode.class, new WhileStatementHandler());
		reg.register(ForNode.class, new ForStatementHandler());
		reg.register(ReturnNode.class, new ReturnStatementHandler());
		reg.register(ExprStatementNode.class, new ExprStatementHandler());
		reg.register(PassNode.class, new PassStatementHandler());
		LoopControlHandler loopControl = new LoopControlHandler();
		reg.register(BreakNode.class, loopControl);
		reg.register(ContinueNode.class, loopControl);
		NestedDefinitionHandler nested = new NestedDefinitionHandler();
		reg.register(FunctionDefNode.class, nested);
		reg.register(ClassDefNode.class, nested);
		return reg;
	}
}
