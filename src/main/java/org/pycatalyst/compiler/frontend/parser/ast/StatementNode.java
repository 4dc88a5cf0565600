package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * Marker for statement nodes.
 */
public interface StatementNode extends AstNode {
}
