package org.leakscope.parser.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An engine for collecting the diagnostics of one parser run.
 * <p>
 * This decouples error reporting from the scanning logic (pattern library, assembler).
 */
public class DiagnosticsEngine implements DiagnosticsSink {

    private final List<ParseWarning> warnings = new ArrayList<>();

    @Override
    public void report(ParseWarning warning) {
        warnings.add(warning);
    }

    /**
     * Checks if warnings have been reported.
     *
     * @return {@code true} if at least one entry has level WARNING.
     */
    public boolean hasWarnings() {
        return warnings.stream().anyMatch(w -> w.level() == ParseWarning.Level.WARNING);
    }

    /**
     * @param code The reason code to count.
     * @return how many diagnostics carry the given code.
     */
    public long count(ReasonCode code) {
        return warnings.stream().filter(w -> w.reasonCode() == code).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<ParseWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
