package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * A formatted string literal. The replacement fields are kept as raw text.
 *
 * @param raw The literal as written, including prefix and quotes.
 * @param span The source range.
 */
public record FormattedStringNode(String raw, SourceSpan span) implements ExpressionNode {
}
