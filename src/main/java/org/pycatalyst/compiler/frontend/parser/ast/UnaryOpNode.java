package org.pycatalyst.compiler.frontend.parser.ast;

public record UnaryOpNode(UnaryOperator op, ExpressionNode operand, SourceSpan span) implements ExpressionNode {
}
