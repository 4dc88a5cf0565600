package org.pycatalyst.compiler.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs while a script is being translated.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents translation. */
        ERROR,
        /** A warning, e.g. a statement that was passed through untranslated. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
