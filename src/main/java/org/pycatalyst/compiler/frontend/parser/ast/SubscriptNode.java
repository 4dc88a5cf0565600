package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * Indexed access {@code value[index]}. A slice index is a {@link SliceNode}; several
 * comma-separated indices form a {@link TupleNode}.
 *
 * @param value The indexed expression.
 * @param index The index expression.
 * @param span The source range.
 */
public record SubscriptNode(ExpressionNode value, ExpressionNode index, SourceSpan span) implements ExpressionNode {
}
