package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An assignment. A chained assignment {@code a = b = 1} has several targets.
 *
 * @param targets The targets, left to right.
 * @param value The assigned value.
 * @param span The source range.
 */
public record AssignNode(List<ExpressionNode> targets, ExpressionNode value, SourceSpan span) implements StatementNode {
}
