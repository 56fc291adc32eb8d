package org.leakscope.report;

import org.leakscope.analysis.SourceCount;
import org.leakscope.analysis.Statistics;
import org.leakscope.parser.api.IssueType;

import java.io.PrintWriter;

/**
 * Prints a short human-readable summary of an analysis to the console.
 */
public final class SummaryPrinter {

    private SummaryPrinter() {}

    public static void print(AnalysisReport report, PrintWriter out) {
        Statistics stats = report.statistics();
        out.printf("Found %d memory issues (%d bytes in %d blocks)%n",
                stats.totalIssues(), stats.totalBytes(), stats.totalBlocks());
        for (IssueType type : IssueType.values()) {
            int count = stats.issuesByType().get(type);
            if (count == 0) {
                continue;
            }
            out.printf("  %-16s %6d  %5.1f%%  %d bytes%n",
                    type.displayName(), count, stats.percentageByType().get(type) * 100.0, stats.bytesByType().get(type));
        }
        int critical = report.classified().criticalIssues().size();
        if (critical > 0) {
            out.printf("Critical issues: %d%n", critical);
        }
        if (report.leakSummary().totalLeakIssues() > 0) {
            out.printf("Leaked: %d bytes in %d blocks%n",
                    report.leakSummary().totalLeakedBytes(), report.leakSummary().totalLeakedBlocks());
        }
        if (!stats.topSources().isEmpty()) {
            out.println("Top sources:");
            for (SourceCount source : stats.topSources()) {
                out.printf("  %4d  %s%n", source.count(), source.source());
            }
        }
        out.flush();
    }
}
