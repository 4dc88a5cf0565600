package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A chain of operands joined by the same short-circuit operator; {@code a or b or c} is one node.
 *
 * @param op The operator.
 * @param values At least two operands.
 * @param span The source range.
 */
public record BoolOpNode(BoolOperator op, List<ExpressionNode> values, SourceSpan span) implements ExpressionNode {
}
