package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * The conditional expression {@code body if test else orElse}.
 */
public record IfExpNode(ExpressionNode test, ExpressionNode body, ExpressionNode orElse, SourceSpan span) implements ExpressionNode {
}
