package org.pycatalyst.compiler.frontend.signatures;

import org.pycatalyst.compiler.frontend.parser.ast.ClassDefNode;
import org.pycatalyst.compiler.frontend.parser.ast.ExpressionNode;
import org.pycatalyst.compiler.frontend.parser.ast.FunctionDefNode;
import org.pycatalyst.compiler.frontend.parser.ast.NameNode;
import org.pycatalyst.compiler.frontend.parser.ast.ParameterNode;
import org.pycatalyst.compiler.frontend.parser.ast.PassNode;
import org.pycatalyst.compiler.frontend.parser.ast.StatementNode;
import org.pycatalyst.compiler.ir.IrClass;
import org.pycatalyst.compiler.ir.IrFunction;

import java.util.ArrayList;
import java.util.List;

/**
 * Registers a class and the signatures of its methods.
 * <p>
 * The first parameter of a method is its receiver and not part of the signature. Statements
 * in the class body other than method definitions are skipped.
 */
public class ClassSignatureCollector implements ISignatureCollector {

    @Override
    public void collect(StatementNode node, SignatureContext ctx) {
        ClassDefNode cls = (ClassDefNode) node;
        if (!cls.decorators().isEmpty()) {
            ctx.skip(cls, "decorated classes not supported");
            return;
        }
        if (!cls.keywords().isEmpty()) {
            ctx.skip(cls, "class keywords not supported");
            return;
        }
        List<String> bases = new ArrayList<>();
        for (ExpressionNode base : cls.bases()) {
            if (!(base instanceof NameNode name)) {
                ctx.skip(cls, "only plain base class names supported");
                return;
            }
            bases.add(name.id());
        }
        IrClass irClass = new IrClass(cls.name(), cls.line(), cls.endLine(), bases);
        if (!ctx.unit().registerClass(irClass)) {
            ctx.skip(cls, "duplicate definition of '" + cls.name() + "'");
            return;
        }
        for (StatementNode member : cls.body()) {
            if (member instanceof FunctionDefNode def) {
                collectMethod(irClass, def, ctx);
            } else if (!(member instanceof PassNode)) {
                ctx.skip(member, "class-level statements not supported");
            }
        }
    }

    private void collectMethod(IrClass owner, FunctionDefNode def, SignatureContext ctx) {
        List<ParameterNode> args = def.parameters().args();
        if (args.isEmpty()) {
            ctx.skip(def, "method without receiver parameter not supported");
            return;
        }
        List<ParameterNode> parameters = args.subList(1, args.size());
        String reason = Signatures.unsupported(def, args);
        if (reason == null && args.get(0).hasDefault()) {
            reason = "receiver parameter with default not supported";
        }
        if (reason != null) {
            ctx.skip(def, reason);
            return;
        }
        IrFunction method = IrFunction.method(owner.name(), def.name(), args.get(0).name(), def.line(), def.endLine());
        Signatures.declareParameters(method, parameters, def.line());
        if (!owner.addMethod(method) || !ctx.unit().registerFunction(method)) {
            ctx.skip(def, "duplicate definition of '" + owner.name() + "." + def.name() + "'");
            return;
        }
        ctx.bind(method, def);
    }
}
