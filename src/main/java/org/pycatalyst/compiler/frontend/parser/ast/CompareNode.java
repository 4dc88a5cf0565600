package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A comparison chain {@code left op1 c1 op2 c2 ...}.
 *
 * @param left The first operand.
 * @param ops The operators, one per comparator.
 * @param comparators The remaining operands.
 * @param span The source range.
 */
public record CompareNode(ExpressionNode left, List<CompareOperator> ops, List<ExpressionNode> comparators, SourceSpan span) implements ExpressionNode {
}
