package org.leakscope.parser.api;

/**
 * Thrown when a log cannot be read or does not look like Memcheck output.
 * <p>
 * Per-line problems inside a valid log never raise this exception; they are
 * reported as diagnostics instead.
 */
public class LogParseException extends Exception {

    /**
     * Constructs a new parse exception with the specified detail message.
     * @param message The detail message.
     */
    public LogParseException(String message) {
        super(message);
    }

    /**
     * Constructs a new parse exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public LogParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
