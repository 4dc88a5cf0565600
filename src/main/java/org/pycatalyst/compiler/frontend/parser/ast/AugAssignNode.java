package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * An augmented assignment such as {@code x += 1}.
 */
public record AugAssignNode(ExpressionNode target, BinaryOperator op, ExpressionNode value, SourceSpan span) implements StatementNode {
}
