package org.pycatalyst.compiler.frontend.parser.ast;

public record BreakNode(SourceSpan span) implements StatementNode {
}
