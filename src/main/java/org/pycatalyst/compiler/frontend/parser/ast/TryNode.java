package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

public record TryNode(List<StatementNode> body, List<ExceptHandlerNode> handlers, List<StatementNode> orElse,
                      List<StatementNode> finalBody, SourceSpan span) implements StatementNode {
}
