package org.leakscope.report;

import org.leakscope.analysis.ClassifiedIssues;
import org.leakscope.analysis.LeakSummary;
import org.leakscope.analysis.SourceAnalysis;
import org.leakscope.analysis.Statistics;
import org.leakscope.parser.diagnostics.ParseWarning;

import java.util.List;

/**
 * Everything a report writer renders, as read-only data.
 *
 * @param sourceName The analyzed input.
 * @param classified The records grouped by type.
 * @param statistics The aggregated statistics.
 * @param leakSummary The totals over the leak categories.
 * @param sources The per-source analysis.
 * @param diagnostics The parser diagnostics.
 */
public record AnalysisReport(
        String sourceName,
        ClassifiedIssues classified,
        Statistics statistics,
        LeakSummary leakSummary,
        List<SourceAnalysis> sources,
        List<ParseWarning> diagnostics
) {
    public AnalysisReport {
        sources = List.copyOf(sources);
        diagnostics = List.copyOf(diagnostics);
    }
}
