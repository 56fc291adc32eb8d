package org.leakscope.parser.frontend.assembler;

/**
 * One entry of the assembler transition table.
 *
 * @param action What the assembler does with the line.
 * @param target The state after the action.
 */
public record Transition(Action action, AssemblerState target) {

    /**
     * The side effect of a transition.
     */
    public enum Action {
        /** Ignore the line. */
        SKIP,
        /** Open a pending record from the header. */
        OPEN,
        /** Append the frame to the pending record. */
        APPEND_FRAME,
        /** Attach the continuation to the pending record. */
        ATTACH_CONTINUATION,
        /** Emit the pending record. */
        CLOSE,
        /** Emit the pending record, then open a new one from the header. */
        CLOSE_AND_OPEN
    }
}
