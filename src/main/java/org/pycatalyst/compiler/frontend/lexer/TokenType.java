package org.pycatalyst.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** An identifier, such as a variable or function name. */
    IDENTIFIER,
    /** A reserved word such as {@code def} or {@code while}. */
    KEYWORD,
    /** An integer or floating point literal. */
    NUMBER,
    /** A string literal, possibly prefixed. */
    STRING,

    /** An operator or delimiter. */
    OPERATOR,

    // Layout.
    /** The end of a logical line. */
    NEWLINE,
    /** An increase of the indentation level. */
    INDENT,
    /** A decrease of the indentation level. */
    DEDENT,
    /** Represents the end of the source file. */
    END_OF_FILE
}
