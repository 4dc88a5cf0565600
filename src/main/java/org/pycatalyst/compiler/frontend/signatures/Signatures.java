package org.pycatalyst.compiler.frontend.signatures;

import org.pycatalyst.compiler.frontend.irgen.ExpressionTranslator;
import org.pycatalyst.compiler.frontend.irgen.NotTranslatableException;
import org.pycatalyst.compiler.frontend.parser.ast.ConstantKind;
import org.pycatalyst.compiler.frontend.parser.ast.ConstantNode;
import org.pycatalyst.compiler.frontend.parser.ast.ExpressionNode;
import org.pycatalyst.compiler.frontend.parser.ast.FunctionDefNode;
import org.pycatalyst.compiler.frontend.parser.ast.ParameterNode;
import org.pycatalyst.compiler.frontend.parser.ast.UnaryOpNode;
import org.pycatalyst.compiler.frontend.parser.ast.UnaryOperator;
import org.pycatalyst.compiler.frontend.semantics.TypeSlot;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrVariable;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parameter handling shared by the function and class collectors.
 */
final class Signatures {

    private Signatures() {}

    /**
     * @param def A definition.
     * @param parameters The parameters that become part of the signature.
     * @return Why the signature cannot be represented, or {@code null} if it can.
     */
    static String unsupported(FunctionDefNode def, List<ParameterNode> parameters) {
        if (!def.decorators().isEmpty()) {
            return "decorated functions not supported";
        }
        if (!def.parameters().isPlain()) {
            return "only plain positional parameters supported";
        }
        Set<String> names = new HashSet<>();
        for (ParameterNode p : parameters) {
            if (!names.add(p.name())) {
                return "duplicate parameter '" + p.name() + "'";
            }
            if (!p.hasDefault()) {
                continue;
            }
            ConstantNode literal = defaultLiteral(p.defaultValue());
            if (literal == null) {
                return "default of '" + p.name() + "' must be a literal";
            }
            if (literal.kind() == ConstantKind.INT) {
                try {
                    ExpressionTranslator.intLiteral(literal, p.defaultValue() instanceof UnaryOpNode);
                } catch (NotTranslatableException e) {
                    return e.getReason();
                }
            }
        }
        return null;
    }

    /**
     * Adds the parameters; defaulted ones take the type of their literal, the others start as auto.
     */
    static void declareParameters(IrFunction function, List<ParameterNode> parameters, int line) {
        for (ParameterNode p : parameters) {
            TypeSlot slot;
            String spelling = null;
            if (p.hasDefault()) {
                ConstantNode literal = defaultLiteral(p.defaultValue());
                spelling = spell(p.defaultValue(), literal);
                slot = new TypeSlot(typeOf(literal));
            } else {
                slot = new TypeSlot(TypeTag.AUTO);
            }
            function.addParameter(new IrVariable(p.name(), line, slot, function.qualifiedName(), spelling));
        }
    }

    private static ConstantNode defaultLiteral(ExpressionNode value) {
        ExpressionNode inner = value;
        if (value instanceof UnaryOpNode u && u.op() == UnaryOperator.USUB) {
            inner = u.operand();
            if (inner instanceof ConstantNode c && (c.kind() == ConstantKind.INT || c.kind() == ConstantKind.FLOAT)) {
                return c;
            }
            return null;
        }
        if (inner instanceof ConstantNode c && c.value() != null && typeOf(c) != TypeTag.AUTO) {
            return c;
        }
        return null;
    }

    private static TypeTag typeOf(ConstantNode literal) {
        switch (literal.kind()) {
            case STR: return TypeTag.STR;
            case INT: return TypeTag.INT;
            case FLOAT: return TypeTag.FLOAT;
            case BOOL: return TypeTag.BOOL;
            default: return TypeTag.AUTO;
        }
    }

    private static String spell(ExpressionNode value, ConstantNode literal) {
        String sign = value instanceof UnaryOpNode ? "-" : "";
        Object v = literal.value();
        if (v instanceof String s) return ExpressionTranslator.quote(s);
        if (v instanceof Boolean b) return b ? "true" : "false";
        return sign + v;
    }
}
