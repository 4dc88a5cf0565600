package org.pycatalyst.compiler.frontend.parser.ast;

public record RaiseNode(ExpressionNode exception, ExpressionNode cause, SourceSpan span) implements StatementNode {
}
