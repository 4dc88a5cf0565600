package org.pycatalyst.compiler.frontend.parser.ast;

public record ContinueNode(SourceSpan span) implements StatementNode {
}
