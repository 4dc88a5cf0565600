package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * One {@code for target in iter if cond...} clause of a comprehension.
 *
 * @param target The loop target.
 * @param iter The iterated expression.
 * @param conditions The filter conditions.
 */
public record ComprehensionClause(ExpressionNode target, ExpressionNode iter, List<ExpressionNode> conditions) {
}
