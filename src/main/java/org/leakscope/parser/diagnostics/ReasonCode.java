package org.leakscope.parser.diagnostics;

/**
 * Defines unique, testable reason codes for every recoverable problem the parser reports.
 * This decouples tests and consumers from the wording of diagnostic messages.
 */
public enum ReasonCode {
    /** A count token could not be parsed; the enclosing record was dropped. */
    MALFORMED_NUMBER,
    /** A header had the verdict shape but no known category keyword; the record was kept as OTHER. */
    UNRECOGNIZED_ISSUE_TYPE,
    /** Input ended while a record was still open; the record was emitted as-is. */
    INCOMPLETE_TRACE,
    /** A header split across physical lines was re-joined. */
    WORD_BREAK_RECOVERED,
    /** The input contained no lines. */
    EMPTY_INPUT
}
