package org.leakscope.parser.frontend.assembler;

/**
 * The role of one (possibly re-joined) line, as seen by the assembler state machine.
 */
public enum LineKind {
    /** Empty content, typically a bare {@code ==pid==} line. */
    SEPARATOR,
    /** An aggregate total over the whole run. */
    SUMMARY,
    /** An issue header. */
    HEADER,
    /** An {@code at/by} stack frame. */
    FRAME,
    /** A line that extends the open record, e.g. an address description. */
    CONTINUATION,
    /** Anything else: banners, program output, tool chatter. */
    TEXT
}
