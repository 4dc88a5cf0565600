package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

public record ListNode(List<ExpressionNode> elements, SourceSpan span) implements ExpressionNode {
}
