package org.pycatalyst.compiler.ir;

/**
 * One emitted logical statement or block header.
 * <p>
 * The text is already indented and may span several lines. The line range is the range of
 * source lines the fragment stands for; comment reattachment uses it to decide which source
 * lines are covered.
 */
public final class IrFragment {

    private final int startLine;
    private final int endLine;
    private final int endColumn;
    private final String reason;
    private String text;
    private String comment;

    /**
     * Creates a translated fragment.
     * @param startLine The first source line, 1-based.
     * @param endLine The last source line, 1-based.
     * @param endColumn The 0-based column after the last source character on the start line
     *                  that belongs to the translated code.
     * @param text The generated text.
     */
    public IrFragment(int startLine, int endLine, int endColumn, String text) {
        this(startLine, endLine, endColumn, text, null);
    }

    private IrFragment(int startLine, int endLine, int endColumn, String text, String reason) {
        if (endLine < startLine) {
            throw new IllegalArgumentException("Fragment ends before it starts: " + startLine + ".." + endLine);
        }
        this.startLine = startLine;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.text = text;
        this.reason = reason;
    }

    /**
     * Creates a pass-through fragment carrying the reason translation was refused.
     * @param startLine The first source line.
     * @param endLine The last source line.
     * @param text The inert source text.
     * @param reason Why the statement was not translated.
     * @return The fragment.
     */
    public static IrFragment passThrough(int startLine, int endLine, String text, String reason) {
        return new IrFragment(startLine, endLine, Integer.MAX_VALUE, text, reason);
    }

    public int startLine() {
        return startLine;
    }

    public int endLine() {
        return endLine;
    }

    public int endColumn() {
        return endColumn;
    }

    public String text() {
        return text;
    }

    /**
     * @return The trailing comment without the comment marker, or {@code null}.
     */
    public String comment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    /**
     * @return The refusal reason if this is a pass-through fragment, otherwise {@code null}.
     */
    public String reason() {
        return reason;
    }

    public boolean isPassThrough() {
        return reason != null;
    }

    /**
     * @param line A 1-based source line.
     * @return {@code true} if the line lies in this fragment's range.
     */
    public boolean covers(int line) {
        return line >= startLine && line <= endLine;
    }

    /**
     * Appends a line (typically a block closer) to the text.
     * @param line The already indented line.
     */
    public void appendLine(String line) {
        text = text.isEmpty() ? line : text + "\n" + line;
    }

    /**
     * Merges a fragment that starts on the same line, e.g. {@code a = 1; b = 2}. The result is
     * a pass-through only if both parts are.
     * @param other The later fragment.
     * @return A fragment covering both.
     */
    IrFragment mergeWith(IrFragment other) {
        String joined = text.isEmpty() ? other.text : other.text.isEmpty() ? text : text + "\n" + other.text;
        String mergedReason = reason != null && other.reason != null ? reason : null;
        IrFragment merged = new IrFragment(startLine, Math.max(endLine, other.endLine),
                Math.max(endColumn, other.endColumn), joined, mergedReason);
        merged.comment = comment;
        return merged;
    }

    @Override
    public String toString() {
        return startLine + "-" + endLine + ": " + text;
    }
}
