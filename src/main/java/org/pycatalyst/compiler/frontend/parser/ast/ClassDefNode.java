package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A class definition.
 *
 * @param name The class name.
 * @param bases The base class expressions.
 * @param keywords Class keywords such as {@code metaclass=...}.
 * @param decorators The decorator expressions.
 * @param body The body statements.
 * @param span The source range.
 */
public record ClassDefNode(String name, List<ExpressionNode> bases, List<KeywordNode> keywords,
                           List<ExpressionNode> decorators, List<StatementNode> body, SourceSpan span) implements StatementNode {
}
