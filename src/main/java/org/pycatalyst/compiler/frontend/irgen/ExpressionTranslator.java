package org.pycatalyst.compiler.frontend.irgen;

import org.pycatalyst.compiler.frontend.irgen.ported.PortedFunctionRegistry;
import org.pycatalyst.compiler.frontend.parser.ast.AttributeNode;
import org.pycatalyst.compiler.frontend.parser.ast.BinOpNode;
import org.pycatalyst.compiler.frontend.parser.ast.BinaryOperator;
import org.pycatalyst.compiler.frontend.parser.ast.BoolOpNode;
import org.pycatalyst.compiler.frontend.parser.ast.BoolOperator;
import org.pycatalyst.compiler.frontend.parser.ast.CallNode;
import org.pycatalyst.compiler.frontend.parser.ast.CompareNode;
import org.pycatalyst.compiler.frontend.parser.ast.CompareOperator;
import org.pycatalyst.compiler.frontend.parser.ast.ComprehensionNode;
import org.pycatalyst.compiler.frontend.parser.ast.ConstantKind;
import org.pycatalyst.compiler.frontend.parser.ast.ConstantNode;
import org.pycatalyst.compiler.frontend.parser.ast.DictNode;
import org.pycatalyst.compiler.frontend.parser.ast.ExpressionNode;
import org.pycatalyst.compiler.frontend.parser.ast.FormattedStringNode;
import org.pycatalyst.compiler.frontend.parser.ast.IfExpNode;
import org.pycatalyst.compiler.frontend.parser.ast.LambdaNode;
import org.pycatalyst.compiler.frontend.parser.ast.ListNode;
import org.pycatalyst.compiler.frontend.parser.ast.NameNode;
import org.pycatalyst.compiler.frontend.parser.ast.NamedExprNode;
import org.pycatalyst.compiler.frontend.parser.ast.SetNode;
import org.pycatalyst.compiler.frontend.parser.ast.SliceNode;
import org.pycatalyst.compiler.frontend.parser.ast.StarredNode;
import org.pycatalyst.compiler.frontend.parser.ast.SubscriptNode;
import org.pycatalyst.compiler.frontend.parser.ast.TupleNode;
import org.pycatalyst.compiler.frontend.parser.ast.UnaryOpNode;
import org.pycatalyst.compiler.frontend.parser.ast.UnaryOperator;
import org.pycatalyst.compiler.frontend.parser.ast.YieldNode;
import org.pycatalyst.compiler.frontend.semantics.SymbolNotFoundException;
import org.pycatalyst.compiler.frontend.semantics.SymbolResolver;
import org.pycatalyst.compiler.frontend.semantics.TypeLattice;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrCollection;
import org.pycatalyst.compiler.ir.IrDependency;
import org.pycatalyst.compiler.ir.IrSet;
import org.pycatalyst.compiler.ir.IrSymbol;
import org.pycatalyst.compiler.ir.IrTuple;
import org.pycatalyst.compiler.ir.IrVariable;
import org.pycatalyst.compiler.ir.IrVector;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Translates expressions into C++ code fragments with their static types.
 * <p>
 * Every form either yields a {@link TypedFragment} or fails with a
 * {@link NotTranslatableException} carrying the reason; nothing is guessed. Binary and boolean
 * operations are always parenthesized so the generated code never depends on C++ precedence.
 */
public class ExpressionTranslator {

	private final SymbolResolver resolver;
	private final CallTranslator calls;

	/**
	 * @param resolver The scope of the function being translated.
	 * @param ported The ported library functions.
	 */
	public ExpressionTranslator(SymbolResolver resolver, PortedFunctionRegistry ported) {
		this.resolver = resolver;
		this.calls = new CallTranslator(this, resolver, ported);
	}

	public SymbolResolver resolver() {
		return resolver;
	}

	/**
	 * Translates an expression.
	 * @param node The expression.
	 * @return The code and its type.
	 * @throws NotTranslatableException if the expression cannot be represented.
	 */
	public TypedFragment translate(ExpressionNode node) throws NotTranslatableException {
		if (node instanceof ConstantNode n) return constant(n);
		if (node instanceof NameNode n) return name(n);
		if (node instanceof BinOpNode n) return binaryOperation(n);
		if (node instanceof BoolOpNode n) return booleanChain(n);
		if (node instanceof UnaryOpNode n) return unaryOperation(n);
		if (node instanceof CompareNode n) return comparison(n);
		if (node instanceof CallNode n) return calls.translate(n);
		if (node instanceof ListNode n) return homogeneous(n.elements(), TypeTag.LIST, IrDependency.VECTOR);
		if (node instanceof SetNode n) return homogeneous(n.elements(), TypeTag.SET, IrDependency.SET);
		if (node instanceof TupleNode n) return tuple(n);
		if (node instanceof SubscriptNode n) return subscript(n);
		if (node instanceof AttributeNode n) return attribute(n);
		if (node instanceof FormattedStringNode) throw new NotTranslatableException("formatted strings not supported");
		if (node instanceof DictNode) throw new NotTranslatableException("dictionaries not supported");
		if (node instanceof ComprehensionNode) throw new NotTranslatableException("comprehensions not supported");
		if (node instanceof LambdaNode) throw new NotTranslatableException("lambda expressions not supported");
		if (node instanceof IfExpNode) throw new NotTranslatableException("conditional expressions not supported");
		if (node instanceof YieldNode) throw new NotTranslatableException("generators not supported");
		if (node instanceof NamedExprNode) throw new NotTranslatableException("assignment expressions not supported");
		if (node instanceof StarredNode) throw new NotTranslatableException("starred expressions not supported");
		if (node instanceof SliceNode) throw new NotTranslatableException("slices not supported");
		throw new NotTranslatableException("unsupported expression: " + node.getClass().getSimpleName());
	}

	/**
	 * Translates an expression that must have a scalar type.
	 * @param node The expression.
	 * @param what What the value is used for, for the refusal reason.
	 * @return The fragment.
	 * @throws NotTranslatableException if the expression fails or yields a collection or no value.
	 */
	public TypedFragment translateScalar(ExpressionNode node, String what) throws NotTranslatableException {
		TypedFragment fragment = translate(node);
		if (fragment.isCollection()) {
			throw new NotTranslatableException("collections not supported as " + what);
		}
		if (fragment.type() == TypeTag.VOID) {
			throw new NotTranslatableException("call without return value used as " + what);
		}
		return fragment;
	}

	/**
	 * Removes one pair of parentheses enclosing the whole expression, so a condition reads
	 * {@code if (a < b)} instead of {@code if ((a < b))}.
	 * @param code Translated code.
	 * @return The code without its enclosing parentheses, or the code itself.
	 */
	public static String unwrap(String code) {
		if (code.length() < 2 || code.charAt(0) != '(' || code.charAt(code.length() - 1) != ')') {
			return code;
		}
		int depth = 0;
		boolean inString = false;
		for (int i = 0; i < code.length() - 1; i++) {
			char c = code.charAt(i);
			if (inString) {
				if (c == '\\') i++;
				else if (c == '"') inString = false;
			} else if (c == '"') {
				inString = true;
			} else if (c == '(') {
				depth++;
			} else if (c == ')' && --depth == 0) {
				return code;
			}
		}
		return code.substring(1, code.length() - 1);
	}

	private TypedFragment constant(ConstantNode node) throws NotTranslatableException {
		switch (node.kind()) {
			case STR:
				resolver.unit().require(IrDependency.STRING);
				return TypedFragment.of(quote((String) node.value()), TypeTag.STR);
			case BOOL:
				return TypedFragment.of(((Boolean) node.value()) ? "true" : "false", TypeTag.BOOL);
			case INT:
				return TypedFragment.of(Integer.toString(intLiteral(node, false)), TypeTag.INT);
			case FLOAT: {
				double value = (Double) node.value();
				if (Double.isInfinite(value) || Double.isNaN(value)) {
					throw new NotTranslatableException("float literal out of range");
				}
				return TypedFragment.of(Double.toString(value), TypeTag.FLOAT);
			}
			case NONE:
				throw new NotTranslatableException("None not supported");
			default:
				throw new NotTranslatableException(node.kind().typeName() + " literals not supported");
		}
	}

	/**
	 * Narrows an integer literal to the 32-bit {@code int} every translated integer is declared as.
	 * @param literal An {@link ConstantKind#INT} literal holding a {@link Long} or {@link BigInteger}.
	 * @param negated Whether the literal is the operand of a unary minus.
	 * @return The (possibly negated) value.
	 * @throws NotTranslatableException if the value does not fit in an {@code int}.
	 */
	public static int intLiteral(ConstantNode literal, boolean negated) throws NotTranslatableException {
		BigInteger value = literal.value() instanceof BigInteger big
				? big
				: BigInteger.valueOf(((Number) literal.value()).longValue());
		if (negated) {
			value = value.negate();
		}
		if (value.bitLength() > 31) {
			throw new NotTranslatableException("integer literal " + value + " out of int range");
		}
		return value.intValue();
	}

	/**
	 * Quotes a string as a C++ string literal.
	 * @param value The raw string.
	 * @return The literal including quotes.
	 */
	public static String quote(String value) {
		StringBuilder sb = new StringBuilder("\"");
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				case '\t' -> sb.append("\\t");
				case '\r' -> sb.append("\\r");
				default -> {
					if (c < 0x20) {
						sb.append(String.format("\\%03o", (int) c));
					} else {
						sb.append(c);
					}
				}
			}
		}
		return sb.append('"').toString();
	}

	private TypedFragment name(NameNode node) throws NotTranslatableException {
		if (resolver.isReceiver(node.id())) {
			throw new NotTranslatableException("bare reference to '" + node.id() + "' not supported");
		}
		try {
			return symbol(node.id(), resolver.resolve(node.id()));
		} catch (SymbolNotFoundException e) {
			throw usedBeforeDeclaration(node.id());
		}
	}

	private static TypedFragment symbol(String code, IrSymbol symbol) {
		if (symbol instanceof IrCollection collection) {
			return new TypedFragment(code, collection.kind(), collection.elementTypes());
		}
		return TypedFragment.of(code, symbol.expressionType());
	}

	/**
	 * @param name An unresolved name.
	 * @return The refusal for a name that is not (yet) declared.
	 */
	static NotTranslatableException usedBeforeDeclaration(String name) {
		return new NotTranslatableException("'" + name + "' used before declaration");
	}

	private TypedFragment binaryOperation(BinOpNode node) throws NotTranslatableException {
		TypedFragment left = translateScalar(node.left(), "operands");
		TypedFragment right = translateScalar(node.right(), "operands");
		BinaryOperator op = node.op();
		switch (op) {
			case POW:
				resolver.unit().require(IrDependency.MATH);
				return TypedFragment.of("std::pow(" + left.code() + ", " + right.code() + ")", TypeTag.FLOAT);
			case FLOOR_DIV: {
				String division = "(" + left.code() + " / " + right.code() + ")";
				boolean bothInt = left.type() == TypeTag.INT && right.type() == TypeTag.INT;
				return TypedFragment.of(bothInt ? division : TypeLattice.truncatingCast(division), TypeTag.INT);
			}
			case DIV: {
				boolean bothFloat = left.type() == TypeTag.FLOAT && right.type() == TypeTag.FLOAT;
				String dividend = bothFloat ? left.code() : TypeLattice.wideningCast(left.code());
				return TypedFragment.of("(" + dividend + " / " + right.code() + ")", TypeTag.FLOAT);
			}
			case MAT_MULT:
				throw new NotTranslatableException("matrix multiplication not supported");
			default:
				return TypedFragment.of("(" + left.code() + " " + op.symbol() + " " + right.code() + ")",
						TypeLattice.unify(left.type(), right.type()));
		}
	}

	private TypedFragment booleanChain(BoolOpNode node) throws NotTranslatableException {
		if (node.values().size() < 2) {
			throw new NotTranslatableException("boolean operation needs two operands");
		}
		String separator = node.op() == BoolOperator.AND ? " && " : " || ";
		List<String> codes = new ArrayList<>();
		TypeTag common = null;
		boolean uniform = true;
		for (ExpressionNode value : node.values()) {
			TypedFragment operand = translateScalar(value, "operands");
			codes.add(operand.code());
			if (common == null) {
				common = operand.type();
			} else if (common != operand.type()) {
				uniform = false;
			}
		}
		return TypedFragment.of("(" + String.join(separator, codes) + ")", uniform ? common : TypeTag.AUTO);
	}

	private TypedFragment unaryOperation(UnaryOpNode node) throws NotTranslatableException {
		if (node.op() == UnaryOperator.USUB && node.operand() instanceof ConstantNode c && c.kind() == ConstantKind.INT) {
			int value = intLiteral(c, true);
			// 2147483648 alone does not fit, so the minimum is spelled as an expression
			return TypedFragment.of(value == Integer.MIN_VALUE ? "(-2147483647 - 1)" : Integer.toString(value), TypeTag.INT);
		}
		TypedFragment operand = translateScalar(node.operand(), "operands");
		if (node.op() == UnaryOperator.NOT) {
			return TypedFragment.of("!" + operand.code(), TypeTag.BOOL);
		}
		// Every other prefix operator is typed int whatever the operand is.
		return TypedFragment.of(node.op().symbol() + operand.code(), TypeTag.INT);
	}

	private TypedFragment comparison(CompareNode node) throws NotTranslatableException {
		for (CompareOperator op : node.ops()) {
			if (op == CompareOperator.IN || op == CompareOperator.NOT_IN) {
				throw new NotTranslatableException("membership tests not supported");
			}
			if (!op.isRelational()) {
				throw new NotTranslatableException("identity tests not supported");
			}
		}
		List<String> pairs = new ArrayList<>();
		TypedFragment left = translateScalar(node.left(), "operands");
		for (int i = 0; i < node.ops().size(); i++) {
			TypedFragment right = translateScalar(node.comparators().get(i), "operands");
			pairs.add("(" + left.code() + " " + node.ops().get(i).symbol() + " " + right.code() + ")");
			left = right;
		}
		String code = pairs.size() == 1 ? pairs.get(0) : "(" + String.join(" && ", pairs) + ")";
		return TypedFragment.of(code, TypeTag.BOOL);
	}

	private TypedFragment homogeneous(List<ExpressionNode> elements, TypeTag kind, IrDependency dependency) throws NotTranslatableException {
		List<TypedFragment> translated = elements(elements);
		TypeTag elementType = translated.get(0).type();
		for (TypedFragment element : translated) {
			if (element.type() != elementType) {
				throw new NotTranslatableException("heterogeneous collection not supported");
			}
		}
		resolver.unit().require(dependency);
		String code = translated.stream().map(TypedFragment::code).collect(Collectors.joining(", ", "{", "}"));
		return new TypedFragment(code, kind, List.of(elementType));
	}

	private TypedFragment tuple(TupleNode node) throws NotTranslatableException {
		List<TypedFragment> translated = elements(node.elements());
		resolver.unit().require(IrDependency.TUPLE);
		String code = translated.stream().map(TypedFragment::code).collect(Collectors.joining(", ", "std::make_tuple(", ")"));
		return new TypedFragment(code, TypeTag.TUPLE, translated.stream().map(TypedFragment::type).collect(Collectors.toList()));
	}

	private List<TypedFragment> elements(List<ExpressionNode> elements) throws NotTranslatableException {
		if (elements.isEmpty()) {
			throw new NotTranslatableException("empty collection literal not supported");
		}
		List<TypedFragment> translated = new ArrayList<>();
		for (ExpressionNode element : elements) {
			TypedFragment fragment = translateScalar(element, "collection elements");
			if (!fragment.type().inLattice() || fragment.type() == TypeTag.AUTO) {
				throw new NotTranslatableException("element type could not be inferred");
			}
			translated.add(fragment);
		}
		return translated;
	}

	private TypedFragment subscript(SubscriptNode node) throws NotTranslatableException {
		if (node.index() instanceof SliceNode) {
			throw new NotTranslatableException("slices not supported");
		}
		String baseCode;
		IrSymbol base;
		try {
			if (node.value() instanceof NameNode name && !resolver.isReceiver(name.id())) {
				baseCode = name.id();
				base = resolver.resolveIndexBase(name.id());
			} else if (isReceiverAttribute(node.value())) {
				AttributeNode attribute = (AttributeNode) node.value();
				baseCode = "this->" + attribute.attr();
				base = resolver.resolveMember(attribute.attr());
			} else {
				throw new NotTranslatableException("indexed access only supported on names");
			}
		} catch (SymbolNotFoundException e) {
			throw usedBeforeDeclaration(e.getSymbolName());
		}

		if (base instanceof IrTuple tuple) {
			int index = literalIndex(node.index());
			if (index < 0 || index >= tuple.arity()) {
				throw new NotTranslatableException("tuple index " + index + " out of range");
			}
			return TypedFragment.of("std::get<" + index + ">(" + baseCode + ")", tuple.elementTypes().get(index));
		}
		if (base instanceof IrSet) {
			throw new NotTranslatableException("sets are not indexable");
		}

		if (isNegativeLiteral(node.index())) {
			throw new NotTranslatableException("negative indices not supported");
		}
		TypedFragment index = translateScalar(node.index(), "index");
		if (index.type() != TypeTag.INT && index.type() != TypeTag.AUTO) {
			throw new NotTranslatableException("index must be an int");
		}
		if (base instanceof IrVector vector) {
			return TypedFragment.of(baseCode + "[" + index.code() + "]", vector.elementType().get());
		}
		IrVariable variable = (IrVariable) base;
		TypeTag type = variable.type().get();
		if (type == TypeTag.STR) {
			return TypedFragment.of("std::string(1, " + baseCode + "[" + index.code() + "])", TypeTag.STR);
		}
		if (type == TypeTag.AUTO) {
			return TypedFragment.of(baseCode + "[" + index.code() + "]", TypeTag.AUTO);
		}
		throw new NotTranslatableException("indexing a " + type + " value not supported");
	}

	private int literalIndex(ExpressionNode index) throws NotTranslatableException {
		if (index instanceof ConstantNode c && c.kind() == ConstantKind.INT) {
			return intLiteral(c, false);
		}
		if (isNegativeLiteral(index)) {
			throw new NotTranslatableException("negative indices not supported");
		}
		throw new NotTranslatableException("tuple index must be an integer literal");
	}

	private static boolean isNegativeLiteral(ExpressionNode node) {
		return node instanceof UnaryOpNode u && u.op() == UnaryOperator.USUB
				&& u.operand() instanceof ConstantNode c && c.kind() == ConstantKind.INT;
	}

	private TypedFragment attribute(AttributeNode node) throws NotTranslatableException {
		if (!isReceiverAttribute(node)) {
			throw new NotTranslatableException("attribute access not supported");
		}
		try {
			return symbol("this->" + node.attr(), resolver.resolveMember(node.attr()));
		} catch (SymbolNotFoundException e) {
			throw usedBeforeDeclaration(((NameNode) node.value()).id() + "." + node.attr());
		}
	}

	/**
	 * @param node An expression.
	 * @return {@code true} for {@code self.<name>} inside a method.
	 */
	public boolean isReceiverAttribute(ExpressionNode node) {
		return node instanceof AttributeNode a && a.value() instanceof NameNode n && resolver.isReceiver(n.id());
	}
}
