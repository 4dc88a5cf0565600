package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of a parsed file.
 *
 * @param body The top-level statements.
 * @param lineCount The number of source lines.
 */
public record ModuleNode(List<StatementNode> body, int lineCount) {
}
