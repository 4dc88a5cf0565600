package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * A {@code yield} or {@code yield from} expression.
 *
 * @param value The yielded value, or {@code null}.
 * @param from {@code true} for {@code yield from}.
 * @param span The source range.
 */
public record YieldNode(ExpressionNode value, boolean from, SourceSpan span) implements ExpressionNode {
}
