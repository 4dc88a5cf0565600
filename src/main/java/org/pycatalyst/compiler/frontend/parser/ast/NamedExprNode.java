package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * An assignment expression {@code target := value}.
 */
public record NamedExprNode(NameNode target, ExpressionNode value, SourceSpan span) implements ExpressionNode {
}
