package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A {@code for target in iter} loop.
 *
 * @param target The loop target.
 * @param iter The iterated expression.
 * @param body The loop body.
 * @param orElse The {@code else} clause, possibly empty.
 * @param span The source range.
 */
public record ForNode(ExpressionNode target, ExpressionNode iter, List<StatementNode> body, List<StatementNode> orElse,
                      SourceSpan span) implements StatementNode {
}
