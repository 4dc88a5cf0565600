package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * A literal value.
 *
 * @param value The value: a {@link String}, {@link Long}, {@link java.math.BigInteger}, {@link Double}, {@link Boolean} or {@code null}.
 * @param kind The runtime type of the literal.
 * @param span The source range.
 */
public record ConstantNode(Object value, ConstantKind kind, SourceSpan span) implements ExpressionNode {
}
