package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

public record ExceptHandlerNode(ExpressionNode type, String name, List<StatementNode> body, SourceSpan span) implements AstNode {
}
