package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Every node knows the source range it was parsed from.
 */
public interface AstNode {

    /**
     * @return The source range of this node.
     */
    SourceSpan span();

    /**
     * @return The 1-based first line.
     */
    default int line() {
        return span().line();
    }

    /**
     * @return The 1-based last line.
     */
    default int endLine() {
        return span().endLine();
    }
}
