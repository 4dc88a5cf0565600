package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * Marker for expression nodes.
 */
public interface ExpressionNode extends AstNode {
}
