package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A list, set, dict comprehension or generator expression.
 *
 * @param kind The comprehension kind.
 * @param element The element expression, or the key of a dict comprehension.
 * @param value The value of a dict comprehension, otherwise {@code null}.
 * @param clauses The for clauses, outermost first.
 * @param span The source range.
 */
public record ComprehensionNode(ComprehensionKind kind, ExpressionNode element, ExpressionNode value,
                                List<ComprehensionClause> clauses, SourceSpan span) implements ExpressionNode {
}
