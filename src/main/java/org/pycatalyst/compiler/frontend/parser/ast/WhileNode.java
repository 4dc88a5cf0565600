package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

public record WhileNode(ExpressionNode test, List<StatementNode> body, List<StatementNode> orElse, SourceSpan span) implements StatementNode {
}
