package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An {@code import} or {@code from ... import} statement.
 *
 * @param fromModule The module of a {@code from} import, or {@code null}.
 * @param names The imported names, each as written including any {@code as} alias.
 * @param span The source range.
 */
public record ImportNode(String fromModule, List<String> names, SourceSpan span) implements StatementNode {
}
