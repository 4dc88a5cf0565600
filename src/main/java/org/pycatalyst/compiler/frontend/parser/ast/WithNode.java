package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

public record WithNode(List<WithItemNode> items, List<StatementNode> body, SourceSpan span) implements StatementNode {
}
