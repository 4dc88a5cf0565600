package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * A binary arithmetic, bitwise or shift operation.
 *
 * @param left The left operand.
 * @param op The operator.
 * @param right The right operand.
 * @param span The source range.
 */
public record BinOpNode(ExpressionNode left, BinaryOperator op, ExpressionNode right, SourceSpan span) implements ExpressionNode {
}
