package org.pycatalyst.compiler.frontend.parser.ast;

public record PassNode(SourceSpan span) implements StatementNode {
}
