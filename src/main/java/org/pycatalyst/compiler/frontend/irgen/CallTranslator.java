package org.pycatalyst.compiler.frontend.irgen;

import org.pycatalyst.compiler.frontend.irgen.ported.IPortedFunction;
import org.pycatalyst.compiler.frontend.irgen.ported.PortedFunctionRegistry;
import org.pycatalyst.compiler.frontend.parser.ast.AttributeNode;
import org.pycatalyst.compiler.frontend.parser.ast.CallNode;
import org.pycatalyst.compiler.frontend.parser.ast.ExpressionNode;
import org.pycatalyst.compiler.frontend.parser.ast.NameNode;
import org.pycatalyst.compiler.frontend.parser.ast.StarredNode;
import org.pycatalyst.compiler.frontend.semantics.SymbolResolver;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrClass;
import org.pycatalyst.compiler.ir.IrCollection;
import org.pycatalyst.compiler.ir.IrDependency;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrSet;
import org.pycatalyst.compiler.ir.IrVariable;
import org.pycatalyst.compiler.ir.IrVector;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Translates call expressions.
 * <p>
 * Callees are tried in a fixed order: methods on a receiver (collection operations, same-class
 * methods, the {@code math} module), primitive type names used as casts, user functions
 * registered in pass 1 and finally the ported library functions.
 */
final class CallTranslator {

	private static final String MATH_MODULE = "math";

	private final ExpressionTranslator expressions;
	private final SymbolResolver resolver;
	private final PortedFunctionRegistry ported;

	CallTranslator(ExpressionTranslator expressions, SymbolResolver resolver, PortedFunctionRegistry ported) {
		this.expressions = expressions;
		this.resolver = resolver;
		this.ported = ported;
	}

	TypedFragment translate(CallNode call) throws NotTranslatableException {
		if (!call.keywords().isEmpty()) {
			throw new NotTranslatableException("keyword arguments not supported");
		}
		for (ExpressionNode arg : call.args()) {
			if (arg instanceof StarredNode) {
				throw new NotTranslatableException("starred arguments not supported");
			}
		}
		if (call.func() instanceof AttributeNode attribute) {
			return attributeCall(attribute, call.args());
		}
		if (call.func() instanceof NameNode name) {
			return namedCall(name.id(), call.args());
		}
		throw new NotTranslatableException("calls on computed callees not supported");
	}

	private TypedFragment attributeCall(AttributeNode callee, List<ExpressionNode> args) throws NotTranslatableException {
		String method = callee.attr();
		if (expressions.isReceiverAttribute(callee.value())) {
			String member = ((AttributeNode) callee.value()).attr();
			Optional<IrCollection> collection = resolver.enclosingClass().flatMap(c -> c.collections().get(member));
			if (collection.isEmpty()) {
				throw new NotTranslatableException("method call on 'self." + member + "' not supported");
			}
			return collectionCall("this->" + member, collection.get(), method, args);
		}
		if (!(callee.value() instanceof NameNode receiver)) {
			throw new NotTranslatableException("method calls on expressions not supported");
		}
		if (resolver.isReceiver(receiver.id())) {
			Optional<IrCollection> member = resolver.enclosingClass().flatMap(c -> c.collections().get(method));
			if (member.isEmpty()) {
				return selfMethodCall(method, args);
			}
			throw new NotTranslatableException("calling collection '" + method + "' not supported");
		}
		Optional<IrCollection> collection = resolver.resolveCollection(receiver.id());
		if (collection.isPresent()) {
			return collectionCall(receiver.id(), collection.get(), method, args);
		}
		if (MATH_MODULE.equals(receiver.id()) && resolver.resolveLocalScope(MATH_MODULE).isEmpty()) {
			return portedCall(method, args);
		}
		throw new NotTranslatableException("method call '" + receiver.id() + "." + method + "' not supported");
	}

	private TypedFragment selfMethodCall(String method, List<ExpressionNode> args) throws NotTranslatableException {
		IrClass owner = resolver.enclosingClass()
				.orElseThrow(() -> new NotTranslatableException("'" + method + "' is not in scope"));
		IrFunction target = owner.methods().get(method);
		if (target == null || target.isConstructor()) {
			throw new NotTranslatableException("'" + owner.name() + "." + method + "' is not in scope");
		}
		return userCall("this->" + method, target, args);
	}

	private TypedFragment collectionCall(String target, IrCollection collection, String method, List<ExpressionNode> args) throws NotTranslatableException {
		switch (method) {
			case "append":
				if (collection instanceof IrVector vector) {
					return elementCall(target + ".push_back", vector.elementType().get(), args);
				}
				break;
			case "add":
				if (collection instanceof IrSet set) {
					return elementCall(target + ".insert", set.elementType().get(), args);
				}
				break;
			case "remove":
			case "discard":
				if (collection instanceof IrSet set) {
					return elementCall(target + ".erase", set.elementType().get(), args);
				}
				break;
			case "clear":
				if (collection instanceof IrVector || collection instanceof IrSet) {
					if (!args.isEmpty()) {
						throw new NotTranslatableException("clear() takes no arguments");
					}
					return TypedFragment.of(target + ".clear()", TypeTag.VOID);
				}
				break;
			default:
				break;
		}
		throw new NotTranslatableException("'" + method + "' not supported on " + collection.kind());
	}

	private TypedFragment elementCall(String target, TypeTag elementType, List<ExpressionNode> args) throws NotTranslatableException {
		if (args.size() != 1) {
			throw new NotTranslatableException("expected exactly one argument");
		}
		TypedFragment element = expressions.translateScalar(args.get(0), "collection elements");
		if (element.type() != elementType) {
			throw new NotTranslatableException("element of type " + element.type() + " does not match " + elementType);
		}
		return TypedFragment.of(target + "(" + element.code() + ")", TypeTag.VOID);
	}

	private TypedFragment namedCall(String name, List<ExpressionNode> args) throws NotTranslatableException {
		TypeTag cast = castTarget(name);
		if (cast != null && resolver.unit().function(name).isEmpty()) {
			return castCall(name, cast, args);
		}
		Optional<IrFunction> function = resolver.unit().function(name);
		if (function.isPresent() && !function.get().isEntry()) {
			return userCall(name, function.get(), args);
		}
		if (resolver.unit().classNamed(name).isPresent()) {
			throw new NotTranslatableException("object construction not supported");
		}
		Optional<IPortedFunction> library = ported.get(name);
		if (library.isPresent()) {
			return library.get().translate(translateArguments(args), resolver.unit());
		}
		throw new NotTranslatableException("'" + name + "' is not in scope");
	}

	private TypedFragment portedCall(String name, List<ExpressionNode> args) throws NotTranslatableException {
		Optional<IPortedFunction> library = ported.get(name);
		if (library.isEmpty()) {
			throw new NotTranslatableException("'" + MATH_MODULE + "." + name + "' not supported");
		}
		return library.get().translate(translateArguments(args), resolver.unit());
	}

	private static TypeTag castTarget(String name) {
		switch (name) {
			case "int": return TypeTag.INT;
			case "float": return TypeTag.FLOAT;
			case "bool": return TypeTag.BOOL;
			case "str": return TypeTag.STR;
			default: return null;
		}
	}

	private TypedFragment castCall(String name, TypeTag target, List<ExpressionNode> args) throws NotTranslatableException {
		if (args.size() != 1) {
			throw new NotTranslatableException(name + "() takes exactly one argument");
		}
		TypedFragment value = expressions.translateScalar(args.get(0), "cast arguments");
		boolean fromString = value.type() == TypeTag.STR;
		switch (target) {
			case INT:
				return TypedFragment.of(fromString ? "std::stoi(" + value.code() + ")" : "(int)(" + value.code() + ")", TypeTag.INT);
			case FLOAT:
				return TypedFragment.of(fromString ? "std::stod(" + value.code() + ")" : "(double)(" + value.code() + ")", TypeTag.FLOAT);
			case BOOL:
				if (fromString) {
					throw new NotTranslatableException("bool() of a string not supported");
				}
				return TypedFragment.of("(bool)(" + value.code() + ")", TypeTag.BOOL);
			default:
				resolver.unit().require(IrDependency.STRING);
				return TypedFragment.of(fromString ? value.code() : "std::to_string(" + value.code() + ")", TypeTag.STR);
		}
	}

	/**
	 * Calls a registered function or method. Arguments are translated before any parameter is
	 * refined so a refused call leaves the signature untouched.
	 */
	private TypedFragment userCall(String spelling, IrFunction target, List<ExpressionNode> args) throws NotTranslatableException {
		List<IrVariable> parameters = new ArrayList<>(target.parameters().values());
		if (args.size() < target.requiredParameterCount() || args.size() > parameters.size()) {
			throw new NotTranslatableException("'" + target.name() + "' expects " + arity(target, parameters.size())
					+ " arguments, got " + args.size());
		}
		List<TypedFragment> translated = new ArrayList<>();
		for (ExpressionNode arg : args) {
			translated.add(expressions.translateScalar(arg, "arguments"));
		}
		for (int i = 0; i < translated.size(); i++) {
			parameters.get(i).type().unify(translated.get(i).type());
		}
		String code = translated.stream().map(TypedFragment::code).collect(Collectors.joining(", ", spelling + "(", ")"));
		TypeTag returned = target.returnType().get();
		if (returned == TypeTag.VOID && !target.isTranslated()) {
			// body not seen yet (forward or recursive call), C++ deduces the type
			returned = TypeTag.AUTO;
		}
		return TypedFragment.of(code, returned);
	}

	private static String arity(IrFunction target, int total) {
		int required = target.requiredParameterCount();
		return required == total ? Integer.toString(total) : required + " to " + total;
	}

	private List<TypedFragment> translateArguments(List<ExpressionNode> args) throws NotTranslatableException {
		List<TypedFragment> translated = new ArrayList<>();
		for (ExpressionNode arg : args) {
			translated.add(expressions.translate(arg));
		}
		return translated;
	}
}
