package org.pycatalyst.compiler.frontend.parser.ast;

public record LambdaNode(ParametersNode parameters, ExpressionNode body, SourceSpan span) implements ExpressionNode {
}
