package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * Member access {@code value.attr}.
 *
 * @param value The object expression.
 * @param attr The member name.
 * @param span The source range.
 */
public record AttributeNode(ExpressionNode value, String attr, SourceSpan span) implements ExpressionNode {
}
