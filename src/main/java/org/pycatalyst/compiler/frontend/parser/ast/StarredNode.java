package org.pycatalyst.compiler.frontend.parser.ast;

public record StarredNode(ExpressionNode value, SourceSpan span) implements ExpressionNode {
}
