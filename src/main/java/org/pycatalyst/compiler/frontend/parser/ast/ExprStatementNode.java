package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * An expression evaluated for its side effects.
 *
 * @param value The expression.
 * @param span The source range.
 */
public record ExprStatementNode(ExpressionNode value, SourceSpan span) implements StatementNode {
}
