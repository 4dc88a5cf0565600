package org.pycatalyst.compiler.frontend.parser.ast;

public record AssertNode(ExpressionNode test, ExpressionNode message, SourceSpan span) implements StatementNode {
}
