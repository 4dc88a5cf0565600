package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A {@code global} or {@code nonlocal} declaration.
 */
public record GlobalNode(List<String> names, boolean nonlocal, SourceSpan span) implements StatementNode {
}
