package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A dict display. A {@code null} key marks a {@code **mapping} entry.
 *
 * @param keys The keys.
 * @param values The values, parallel to {@code keys}.
 * @param span The source range.
 */
public record DictNode(List<ExpressionNode> keys, List<ExpressionNode> values, SourceSpan span) implements ExpressionNode {
}
