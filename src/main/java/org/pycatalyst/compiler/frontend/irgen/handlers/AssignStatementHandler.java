package org.pycatalyst.compiler.frontend.irgen.handlers;

import org.pycatalyst.compiler.frontend.irgen.IStatementHandler;
import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.irgen.TranslationContext;
import org.pycatalyst.compiler.frontend.irgen.TypedFragment;
import org.pycatalyst.compiler.frontend.parser.ast.AssignNode;
import org.pycatalyst.compiler.frontend.parser.ast.AttributeNode;
import org.pycatalyst.compiler.frontend.parser.ast.ExpressionNode;
import org.pycatalyst.compiler.frontend.parser.ast.ListNode;
import org.pycatalyst.compiler.frontend.parser.ast.NameNode;
import org.pycatalyst.compiler.frontend.parser.ast.SubscriptNode;
import org.pycatalyst.compiler.frontend.parser.ast.TupleNode;
import org.pycatalyst.compiler.frontend.semantics.SymbolResolver;
import org.pycatalyst.compiler.frontend.semantics.TypeLattice;
import org.pycatalyst.compiler.frontend.semantics.TypeSlot;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrClass;
import org.pycatalyst.compiler.ir.IrCollection;
import org.pycatalyst.compiler.ir.IrDependency;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrSet;
import org.pycatalyst.compiler.ir.IrTuple;
import org.pycatalyst.compiler.ir.IrVariable;
import org.pycatalyst.compiler.ir.IrVector;

import java.util.Optional;

/**
 * Translates single-target assignments.
 * <p>
 * A first assignment declares the variable, attribute or collection with the inferred type;
 * later assignments must keep the type, except that a float variable accepts an int value.
 */
public final class AssignStatementHandler implements IStatementHandler<AssignNode> {

	/**
	 * {@inheritDoc}
	 * <p>
	 * Symbols are only declared once the value has been translated, so a refused assignment
	 * leaves the scope unchanged.
	 */
	@Override
	public void translate(AssignNode node, TranslationContext ctx) throws NotTranslatableException {
		if (node.targets().size() != 1) {
			throw new NotTranslatableException("chained assignment not supported");
		}
		ExpressionNode target = node.targets().get(0);
		if (target instanceof TupleNode || target instanceof ListNode) {
			throw new NotTranslatableException("unpacking assignment not supported");
		}
		if (target instanceof SubscriptNode) {
			throw new NotTranslatableException("assignment to indexed elements not supported");
		}
		if (target instanceof AttributeNode attribute) {
			if (!ctx.function().isMethod()) {
				throw new NotTranslatableException("attribute assignment outside a method not supported");
			}
			if (!ctx.expressions().isReceiverAttribute(attribute)) {
				throw new NotTranslatableException("attribute assignment not supported");
			}
			assignMember(attribute.attr(), node, ctx);
			return;
		}
		if (target instanceof NameNode name) {
			assignName(name.id(), node, ctx);
			return;
		}
		throw new NotTranslatableException("unsupported assignment target");
	}

	private void assignMember(String name, AssignNode node, TranslationContext ctx) throws NotTranslatableException {
		SymbolResolver resolver = ctx.resolver();
		IrClass owner = resolver.enclosingClass()
				.orElseThrow(() -> new NotTranslatableException("attribute assignment outside a class not supported"));
		TypedFragment value = valueOf(node, ctx);
		String code = "this->" + name + " = " + value.code() + ";";

		if (value.isCollection()) {
			if (owner.attributes().containsKey(name)) {
				throw new NotTranslatableException("cannot assign a " + value.type() + " to attribute '" + name + "'");
			}
			Optional<IrCollection> existing = owner.collections().get(name);
			if (existing.isPresent()) {
				requireSameShape(existing.get(), value, "self." + name);
			} else {
				IrCollection created = newCollection(name, node.line(), value);
				owner.collections().put(created);
				ctx.require(created.dependency());
			}
			ctx.emitLine(node, code);
			return;
		}

		if (owner.collections().get(name).isPresent()) {
			throw new NotTranslatableException("cannot assign " + value.type() + " to collection 'self." + name + "'");
		}
		IrVariable existing = owner.attributes().get(name);
		if (existing != null) {
			requireAssignable(existing, value, "self." + name);
		} else {
			TypeSlot slot = sharedSlot(node.value(), resolver);
			if (slot == null) {
				if (value.type() == TypeTag.AUTO) {
					throw new NotTranslatableException("type of 'self." + name + "' could not be inferred");
				}
				slot = new TypeSlot(value.type());
			}
			owner.addAttribute(new IrVariable(name, node.line(), slot, owner.name()));
			if (value.type() == TypeTag.STR) {
				ctx.require(IrDependency.STRING);
			}
		}
		ctx.emitLine(node, code);
	}

	/**
	 * An attribute initialized straight from a parameter or local shares its type slot, so the
	 * attribute follows the refinement of a parameter by later call sites.
	 */
	private static TypeSlot sharedSlot(ExpressionNode value, SymbolResolver resolver) {
		if (value instanceof NameNode name) {
			return resolver.resolveAssignable(name.id()).map(IrVariable::type).orElse(null);
		}
		return null;
	}

	private void assignName(String name, AssignNode node, TranslationContext ctx) throws NotTranslatableException {
		SymbolResolver resolver = ctx.resolver();
		IrFunction function = ctx.function();
		if (resolver.isReceiver(name)) {
			throw new NotTranslatableException("rebinding '" + name + "' not supported");
		}
		TypedFragment value = valueOf(node, ctx);
		Optional<IrVariable> variable = resolver.resolveAssignable(name);
		Optional<IrCollection> collection = function.collections().get(name);

		if (value.isCollection()) {
			if (variable.isPresent()) {
				throw new NotTranslatableException("cannot assign a " + value.type() + " to '" + name + "' of type " + variable.get().type().get());
			}
			if (collection.isPresent()) {
				requireSameShape(collection.get(), value, name);
				ctx.emitLine(node, name + " = " + value.code() + ";");
				return;
			}
			IrCollection created = newCollection(name, node.line(), value);
			function.collections().put(created);
			ctx.require(created.dependency());
			ctx.emitLine(node, created.cppType() + " " + name + " = " + value.code() + ";");
			return;
		}

		if (collection.isPresent()) {
			throw new NotTranslatableException("cannot assign " + value.type() + " to collection '" + name + "'");
		}
		if (variable.isPresent()) {
			requireAssignable(variable.get(), value, name);
			ctx.emitLine(node, name + " = " + value.code() + ";");
			return;
		}
		function.declareLocal(new IrVariable(name, node.line(), new TypeSlot(value.type()), function.qualifiedName()));
		if (value.type() == TypeTag.STR) {
			ctx.require(IrDependency.STRING);
		}
		ctx.emitLine(node, value.type().cppName() + " " + name + " = " + value.code() + ";");
	}

	private static TypedFragment valueOf(AssignNode node, TranslationContext ctx) throws NotTranslatableException {
		TypedFragment value = ctx.expressions().translate(node.value());
		if (value.type() == TypeTag.VOID) {
			throw new NotTranslatableException("call without return value used as value");
		}
		return value;
	}

	private static void requireAssignable(IrVariable variable, TypedFragment value, String shownName) throws NotTranslatableException {
		TypeTag declared = variable.type().get();
		if (!TypeLattice.acceptsAssignment(declared, value.type())) {
			throw new NotTranslatableException("cannot assign " + value.type() + " to '" + shownName + "' of type " + declared);
		}
	}

	private static void requireSameShape(IrCollection existing, TypedFragment value, String shownName) throws NotTranslatableException {
		if (existing.kind() != value.type() || !existing.elementTypes().equals(value.elementTypes())) {
			throw new NotTranslatableException("cannot reassign '" + shownName + "' of type " + existing.cppType()
					+ " with a " + value.type() + " of " + value.elementTypes());
		}
	}

	private static IrCollection newCollection(String name, int line, TypedFragment value) {
		switch (value.type()) {
			case LIST:
				return new IrVector(name, line, TypeSlot.fixed(value.elementTypes().get(0)));
			case SET:
				return new IrSet(name, line, TypeSlot.fixed(value.elementTypes().get(0)));
			case TUPLE:
				return new IrTuple(name, line, value.elementTypes());
			default:
				throw new IllegalArgumentException("Not a collection: " + value.type());
		}
	}
}
