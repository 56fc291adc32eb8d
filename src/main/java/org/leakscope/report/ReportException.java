package org.leakscope.report;

/**
 * Thrown when a report medium cannot be created or written.
 */
public class ReportException extends Exception {

    public ReportException(String message) {
        super(message);
    }

    public ReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
