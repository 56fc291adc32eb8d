package org.leakscope.parser.frontend.assembler;

import org.leakscope.parser.frontend.assembler.Transition.Action;

/**
 * The states of the issue assembler and its transition table.
 * <p>
 * The table is independent of the pattern library: it only sees {@link LineKind}s.
 * <pre>
 *  SCANNING + HEADER        -> OPEN,                IN_TRACE
 *  SCANNING + anything else -> SKIP,                SCANNING
 *  IN_TRACE + HEADER        -> CLOSE_AND_OPEN,      IN_TRACE
 *  IN_TRACE + FRAME         -> APPEND_FRAME,        IN_TRACE
 *  IN_TRACE + CONTINUATION  -> ATTACH_CONTINUATION, IN_TRACE
 *  IN_TRACE + anything else -> CLOSE,               SCANNING
 *  any      + end of input  -> CLOSE if IN_TRACE,   FINISHED
 * </pre>
 */
public enum AssemblerState {
    /** Looking for the next header. */
    SCANNING,
    /** Accumulating frames for the pending record. */
    IN_TRACE,
    /** End of input was reached; no further lines are accepted. */
    FINISHED;

    /**
     * Looks up the transition for a line.
     *
     * @param kind The kind of the line.
     * @return The action and the next state.
     * @throws IllegalStateException if the machine already finished.
     */
    public Transition on(LineKind kind) {
        switch (this) {
            case SCANNING:
                return kind == LineKind.HEADER
                        ? new Transition(Action.OPEN, IN_TRACE)
                        : new Transition(Action.SKIP, SCANNING);
            case IN_TRACE:
                switch (kind) {
                    case HEADER:
                        return new Transition(Action.CLOSE_AND_OPEN, IN_TRACE);
                    case FRAME:
                        return new Transition(Action.APPEND_FRAME, IN_TRACE);
                    case CONTINUATION:
                        return new Transition(Action.ATTACH_CONTINUATION, IN_TRACE);
                    default:
                        return new Transition(Action.CLOSE, SCANNING);
                }
            default:
                throw new IllegalStateException("No transitions after end of input");
        }
    }

    /**
     * @return the transition taken when the input ends in this state.
     */
    public Transition onEndOfInput() {
        return this == IN_TRACE
                ? new Transition(Action.CLOSE, FINISHED)
                : new Transition(Action.SKIP, FINISHED);
    }
}
