package org.pycatalyst.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param value The processed value: the decoded content of a string, the {@link Long}, {@link java.math.BigInteger}
 *              (beyond 64 bits) or {@link Double} of a number, otherwise {@code null}.
 * @param line The 1-based line where the token starts.
 * @param column The 0-based column where the token starts.
 * @param endLine The line where the token ends.
 * @param endColumn The 0-based column after the last character of the token.
 * @param fileName The logical file name the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        int endLine,
        int endColumn,
        String fileName
) {

    /**
     * @param type A token type.
     * @param text A token text.
     * @return {@code true} if this token has the given type and text.
     */
    public boolean is(TokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }
}
