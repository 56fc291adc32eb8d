package org.leakscope.analysis;

import org.leakscope.parser.api.IssueSeverity;
import org.leakscope.parser.api.IssueType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated figures over one set of classified records. Immutable; every per-type and per-level
 * map has an entry for every enum constant.
 *
 * @param totalIssues The number of records.
 * @param totalBytes The summed byte counts.
 * @param totalBlocks The summed block counts.
 * @param issuesByType Record count per type.
 * @param bytesByType Summed bytes per type.
 * @param blocksByType Summed blocks per type.
 * @param percentageByType Each type's share of {@code totalIssues}, as a fraction in {@code [0, 1]}.
 * @param bytePercentageByType Each type's share of {@code totalBytes}, as a fraction in {@code [0, 1]}.
 * @param topSources The most frequent sources, descending by count, ties in first-seen order.
 * @param severityDistribution Record count per severity level.
 */
public record Statistics(
        int totalIssues,
        long totalBytes,
        long totalBlocks,
        Map<IssueType, Integer> issuesByType,
        Map<IssueType, Long> bytesByType,
        Map<IssueType, Long> blocksByType,
        Map<IssueType, Double> percentageByType,
        Map<IssueType, Double> bytePercentageByType,
        List<SourceCount> topSources,
        Map<IssueSeverity, Integer> severityDistribution
) {

    public Statistics {
        issuesByType = frozen(issuesByType);
        bytesByType = frozen(bytesByType);
        blocksByType = frozen(blocksByType);
        percentageByType = frozen(percentageByType);
        bytePercentageByType = frozen(bytePercentageByType);
        topSources = List.copyOf(topSources);
        severityDistribution = Collections.unmodifiableMap(new EnumMap<>(severityDistribution));
    }

    private static <V> Map<IssueType, V> frozen(Map<IssueType, V> map) {
        return Collections.unmodifiableMap(new EnumMap<>(map));
    }
}
