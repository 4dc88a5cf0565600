package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

public record DeleteNode(List<ExpressionNode> targets, SourceSpan span) implements StatementNode {
}
