package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * A bare identifier.
 *
 * @param id The identifier.
 * @param span The source range.
 */
public record NameNode(String id, SourceSpan span) implements ExpressionNode {
}
