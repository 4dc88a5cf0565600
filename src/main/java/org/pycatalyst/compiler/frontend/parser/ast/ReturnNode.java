package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * A return statement.
 *
 * @param value The returned value, or {@code null}.
 * @param span The source range.
 */
public record ReturnNode(ExpressionNode value, SourceSpan span) implements StatementNode {
}
