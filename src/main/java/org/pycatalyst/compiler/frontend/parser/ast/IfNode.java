package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A conditional. An {@code elif} is an {@code IfNode} with {@code elif} set, as the only
 * statement of the enclosing node's {@code orElse}.
 *
 * @param test The condition.
 * @param body The statements run when the condition holds.
 * @param orElse The {@code elif}/{@code else} branch, possibly empty.
 * @param elif {@code true} if this node was introduced by {@code elif}.
 * @param elseLine The line of this node's own {@code else} keyword, or 0.
 * @param span The source range.
 */
public record IfNode(ExpressionNode test, List<StatementNode> body, List<StatementNode> orElse, boolean elif,
                     int elseLine, SourceSpan span) implements StatementNode {
}
