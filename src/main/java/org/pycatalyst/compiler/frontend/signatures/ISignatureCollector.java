package org.pycatalyst.compiler.frontend.signatures;

import org.pycatalyst.compiler.frontend.parser.ast.StatementNode;

/**
 * Interface for pass-1 signature collection handlers.
 * Each collector registers the declarations of one kind of top-level definition
 * (classes with their methods, free functions) into the unit before any body is translated.
 */
public interface ISignatureCollector {

    /**
     * Collects the signature of a single top-level definition.
     * @param node The definition.
     * @param ctx The collection context holding the unit and the skipped declarations.
     */
    void collect(StatementNode node, SignatureContext ctx);
}
