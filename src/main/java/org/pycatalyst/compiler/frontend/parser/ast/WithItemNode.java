package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * One {@code expr as target} item of a {@code with} statement.
 */
public record WithItemNode(ExpressionNode contextExpr, ExpressionNode target) {
}
