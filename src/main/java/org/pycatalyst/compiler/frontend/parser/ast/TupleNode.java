package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A tuple display, parenthesized or not.
 *
 * @param elements The elements.
 * @param span The source range.
 */
public record TupleNode(List<ExpressionNode> elements, SourceSpan span) implements ExpressionNode {
}
