package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * An annotated assignment {@code target: annotation [= value]}.
 */
public record AnnAssignNode(ExpressionNode target, ExpressionNode annotation, ExpressionNode value, SourceSpan span) implements StatementNode {
}
