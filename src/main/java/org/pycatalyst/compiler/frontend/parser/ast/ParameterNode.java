package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * A single parameter.
 *
 * @param name The parameter name.
 * @param annotation The annotation, or {@code null}.
 * @param defaultValue The default value, or {@code null}.
 * @param span The source range.
 */
public record ParameterNode(String name, ExpressionNode annotation, ExpressionNode defaultValue, SourceSpan span) implements AstNode {

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
