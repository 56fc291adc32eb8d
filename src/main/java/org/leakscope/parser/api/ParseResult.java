package org.leakscope.parser.api;

import org.leakscope.parser.diagnostics.ParseWarning;

import java.util.List;

/**
 * The output of one parser run over one input.
 *
 * @param sourceName The logical name of the parsed input, for messages.
 * @param records The closed issue records in encounter order.
 * @param warnings The recoverable diagnostics raised while scanning.
 * @param linesScanned The number of physical lines consumed.
 */
public record ParseResult(
        String sourceName,
        List<IssueRecord> records,
        List<ParseWarning> warnings,
        int linesScanned
) {
    public ParseResult {
        records = List.copyOf(records);
        warnings = List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
