package org.leakscope.parser.diagnostics;

/**
 * Receives the recoverable diagnostics of a parser run.
 * Implementations must not throw; the parser never aborts because of a diagnostic.
 */
@FunctionalInterface
public interface DiagnosticsSink {

    /**
     * @param warning The diagnostic to accept.
     */
    void report(ParseWarning warning);
}
