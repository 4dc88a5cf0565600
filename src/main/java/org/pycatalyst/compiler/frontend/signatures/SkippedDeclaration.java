package org.pycatalyst.compiler.frontend.signatures;

import org.pycatalyst.compiler.frontend.parser.ast.StatementNode;

/**
 * A declaration that was not registered, kept so its source can be passed through.
 *
 * @param node The declaration or class-level statement.
 * @param reason Why it was skipped.
 */
public record SkippedDeclaration(StatementNode node, String reason) {
}
