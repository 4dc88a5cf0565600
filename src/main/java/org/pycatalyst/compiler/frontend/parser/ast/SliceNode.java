package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * A slice {@code lower:upper:step}; every part may be {@code null}.
 */
public record SliceNode(ExpressionNode lower, ExpressionNode upper, ExpressionNode step, SourceSpan span) implements ExpressionNode {
}
