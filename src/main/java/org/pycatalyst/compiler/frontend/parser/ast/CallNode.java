package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A call. Starred arguments appear in {@code args} as {@link StarredNode}s.
 *
 * @param func The callee.
 * @param args The positional arguments.
 * @param keywords The keyword arguments, including {@code **mapping} entries.
 * @param span The source range.
 */
public record CallNode(ExpressionNode func, List<ExpressionNode> args, List<KeywordNode> keywords, SourceSpan span) implements ExpressionNode {
}
