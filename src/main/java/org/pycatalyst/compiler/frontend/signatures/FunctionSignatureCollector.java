package org.pycatalyst.compiler.frontend.signatures;

import org.pycatalyst.compiler.frontend.parser.ast.FunctionDefNode;
import org.pycatalyst.compiler.frontend.parser.ast.StatementNode;
import org.pycatalyst.compiler.ir.IrFunction;

/**
 * Registers the signature of a top-level function.
 */
public class FunctionSignatureCollector implements ISignatureCollector {

    @Override
    public void collect(StatementNode node, SignatureContext ctx) {
        FunctionDefNode def = (FunctionDefNode) node;
        String reason = Signatures.unsupported(def, def.parameters().args());
        if (reason != null) {
            ctx.skip(def, reason);
            return;
        }
        IrFunction function = IrFunction.free(def.name(), def.line(), def.endLine());
        Signatures.declareParameters(function, def.parameters().args(), def.line());
        if (!ctx.unit().registerFunction(function)) {
            ctx.skip(def, "duplicate definition of '" + def.name() + "'");
            return;
        }
        ctx.bind(function, def);
    }
}
