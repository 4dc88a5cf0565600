package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A function definition. The span starts at the {@code def} keyword, after any decorators.
 *
 * @param name The function name.
 * @param parameters The parameter list.
 * @param returns The return annotation, or {@code null}.
 * @param decorators The decorator expressions.
 * @param body The body statements.
 * @param span The source range.
 */
public record FunctionDefNode(String name, ParametersNode parameters, ExpressionNode returns,
                              List<ExpressionNode> decorators, List<StatementNode> body, SourceSpan span) implements StatementNode {
}
