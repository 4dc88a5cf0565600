package org.pycatalyst.compiler.api;

/**
 * An exception that is thrown when a script cannot be translated at all,
 * e.g. because it does not parse.
 * <p>
 * It is part of the public API and hides the internal exception types of the translator.
 * Statements that merely cannot be represented never raise it; they are passed through.
 */
public class TranslationException extends Exception {

    /**
     * Constructs a new translation exception with the specified detail message.
     * @param message The detail message.
     */
    public TranslationException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new translation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
