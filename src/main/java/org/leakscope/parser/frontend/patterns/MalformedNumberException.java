package org.leakscope.parser.frontend.patterns;

/**
 * Thrown when no canonical count can be extracted from a number token.
 * Callers treat this as a recoverable per-line failure.
 */
public class MalformedNumberException extends Exception {

    private final String token;

    public MalformedNumberException(String token, String reason) {
        super("Malformed number '" + token + "': " + reason);
        this.token = token;
    }

    public MalformedNumberException(String token, String reason, Throwable cause) {
        super("Malformed number '" + token + "': " + reason, cause);
        this.token = token;
    }

    /**
     * @return the offending token as it appeared in the log.
     */
    public String getToken() {
        return token;
    }
}
