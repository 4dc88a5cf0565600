package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * A range in the source file.
 *
 * @param line The 1-based first line.
 * @param column The 0-based column of the first character.
 * @param endLine The 1-based last line.
 * @param endColumn The 0-based column after the last character on {@code endLine}.
 */
public record SourceSpan(int line, int column, int endLine, int endColumn) {

    /**
     * @param end A later span.
     * @return A span from the start of this one to the end of {@code end}.
     */
    public SourceSpan to(SourceSpan end) {
        return new SourceSpan(line, column, end.endLine, end.endColumn);
    }
}
