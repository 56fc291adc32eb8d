package org.leakscope.parser.diagnostics;

/**
 * A single recoverable diagnostic raised while scanning a log.
 *
 * @param level Whether the entry explains a drop ({@link Level#WARNING}) or is informational.
 * @param reasonCode The machine-readable reason.
 * @param message The human-readable message.
 * @param lineNumber The 1-based line number the diagnostic refers to, 0 if none.
 * @param rawText The raw text of the offending line, empty if none.
 */
public record ParseWarning(
        Level level,
        ReasonCode reasonCode,
        String message,
        int lineNumber,
        String rawText
) {
    /**
     * The level of a diagnostic.
     */
    public enum Level {
        /** Something was dropped or altered. */
        WARNING,
        /** Nothing was lost. */
        INFO
    }

    public ParseWarning {
        rawText = rawText == null ? "" : rawText;
    }

    @Override
    public String toString() {
        return String.format("[%s] line %d: %s (%s)", level, lineNumber, message, reasonCode);
    }
}
