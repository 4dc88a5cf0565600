package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * A keyword argument in a call or class header.
 *
 * @param name The keyword, or {@code null} for a {@code **mapping} argument.
 * @param value The value.
 * @param span The source range.
 */
public record KeywordNode(String name, ExpressionNode value, SourceSpan span) implements AstNode {
}
