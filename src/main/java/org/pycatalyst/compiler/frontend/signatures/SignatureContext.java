package org.pycatalyst.compiler.frontend.signatures;

import org.pycatalyst.compiler.diagnostics.CompilerLogger;
import org.pycatalyst.compiler.frontend.parser.ast.FunctionDefNode;
import org.pycatalyst.compiler.frontend.parser.ast.StatementNode;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrUnit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State shared by the signature collectors of one unit.
 */
public final class SignatureContext {

    private final IrUnit unit;
    private final Map<IrFunction, FunctionDefNode> bodies = new LinkedHashMap<>();
    private final List<SkippedDeclaration> skipped = new ArrayList<>();

    public SignatureContext(IrUnit unit) {
        this.unit = unit;
    }

    public IrUnit unit() {
        return unit;
    }

    /**
     * Remembers the definition whose body belongs to a registered function.
     * @param function The registered function.
     * @param definition Its definition.
     */
    public void bind(IrFunction function, FunctionDefNode definition) {
        bodies.put(function, definition);
    }

    /**
     * @return The registered functions with their definitions, in registration order.
     */
    public Map<IrFunction, FunctionDefNode> bodies() {
        return Collections.unmodifiableMap(bodies);
    }

    /**
     * Records a declaration that is not registered.
     * @param node The declaration.
     * @param reason Why it is skipped.
     */
    public void skip(StatementNode node, String reason) {
        skipped.add(new SkippedDeclaration(node, reason));
        CompilerLogger.skippedDeclaration(node.line(), reason);
    }

    public List<SkippedDeclaration> skipped() {
        return Collections.unmodifiableList(skipped);
    }
}
