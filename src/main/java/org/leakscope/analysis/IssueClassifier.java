package org.leakscope.analysis;

import com.typesafe.config.Config;
import org.leakscope.parser.api.IssueRecord;
import org.leakscope.parser.api.IssueSeverity;
import org.leakscope.parser.api.IssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Groups issue records by type and derives statistics from the grouping.
 * <p>
 * All operations are pure transformations of their inputs; the classifier holds no per-run state.
 */
public class IssueClassifier {

    /** Default cap for {@link Statistics#topSources()}. */
    public static final int DEFAULT_TOP_SOURCES_LIMIT = 10;
    /** Source key used by {@link #sourceAnalysis(ClassifiedIssues)} for records without any source. */
    public static final String UNKNOWN_SOURCE = "Unknown";

    private static final Logger LOGGER = LoggerFactory.getLogger(IssueClassifier.class);
    private static final String TOP_SOURCES_LIMIT_KEY = "top-sources-limit";

    private final int topSourcesLimit;

    public IssueClassifier() {
        this(DEFAULT_TOP_SOURCES_LIMIT);
    }

    /**
     * @param topSourcesLimit Maximum number of entries in {@link Statistics#topSources()}; 0 means unlimited.
     */
    public IssueClassifier(int topSourcesLimit) {
        if (topSourcesLimit < 0) {
            throw new IllegalArgumentException("top-sources-limit must not be negative, was " + topSourcesLimit);
        }
        this.topSourcesLimit = topSourcesLimit;
    }

    /**
     * @param analysisConfig The {@code analysis} configuration block.
     * @return A classifier configured from it.
     */
    public static IssueClassifier fromConfig(Config analysisConfig) {
        return new IssueClassifier(analysisConfig.hasPath(TOP_SOURCES_LIMIT_KEY)
                ? analysisConfig.getInt(TOP_SOURCES_LIMIT_KEY)
                : DEFAULT_TOP_SOURCES_LIMIT);
    }

    /**
     * Groups records by type, keeping their order within each type.
     *
     * @param records The records, typically in encounter order.
     * @return The grouping.
     */
    public ClassifiedIssues classify(List<IssueRecord> records) {
        Map<IssueType, List<IssueRecord>> grouped = new EnumMap<>(IssueType.class);
        for (IssueRecord record : records) {
            grouped.computeIfAbsent(record.issueType(), t -> new ArrayList<>()).add(record);
        }
        return new ClassifiedIssues(grouped);
    }

    /**
     * Computes counts, sums, percentages and top sources. Percentages are all zero for an empty input.
     *
     * @param classified The grouping.
     * @return The statistics.
     */
    public Statistics computeStatistics(ClassifiedIssues classified) {
        Map<IssueType, Integer> issuesByType = new EnumMap<>(IssueType.class);
        Map<IssueType, Long> bytesByType = new EnumMap<>(IssueType.class);
        Map<IssueType, Long> blocksByType = new EnumMap<>(IssueType.class);
        Map<IssueSeverity, Integer> severityDistribution = new EnumMap<>(IssueSeverity.class);
        for (IssueSeverity level : IssueSeverity.values()) {
            severityDistribution.put(level, 0);
        }

        int totalIssues = 0;
        long totalBytes = 0;
        long totalBlocks = 0;
        for (IssueType type : IssueType.values()) {
            List<IssueRecord> records = classified.get(type);
            long bytes = 0;
            long blocks = 0;
            for (IssueRecord record : records) {
                bytes += record.bytesCount();
                blocks += record.blocksCount();
                severityDistribution.merge(record.severityLevel(), 1, Integer::sum);
            }
            issuesByType.put(type, records.size());
            bytesByType.put(type, bytes);
            blocksByType.put(type, blocks);
            totalIssues += records.size();
            totalBytes += bytes;
            totalBlocks += blocks;
        }

        Map<IssueType, Double> percentageByType = new EnumMap<>(IssueType.class);
        Map<IssueType, Double> bytePercentageByType = new EnumMap<>(IssueType.class);
        for (IssueType type : IssueType.values()) {
            percentageByType.put(type, share(issuesByType.get(type), totalIssues));
            bytePercentageByType.put(type, share(bytesByType.get(type), totalBytes));
        }

        Statistics statistics = new Statistics(totalIssues, totalBytes, totalBlocks,
                issuesByType, bytesByType, blocksByType, percentageByType, bytePercentageByType,
                topSources(classified), severityDistribution);
        LOGGER.debug("Computed statistics over {} issues, {} bytes", totalIssues, totalBytes);
        return statistics;
    }

    /**
     * Counts records per source key, most frequent first, ties broken by first-seen order.
     */
    private List<SourceCount> topSources(ClassifiedIssues classified) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (IssueRecord record : classified.inEncounterOrder()) {
            sourceKey(record).ifPresent(key -> counts.merge(key, 1, Integer::sum));
        }
        // List.sort is stable, so equal counts keep first-seen order.
        List<SourceCount> ranked = counts.entrySet().stream()
                .map(e -> new SourceCount(e.getKey(), e.getValue()))
                .collect(Collectors.toCollection(ArrayList::new));
        ranked.sort((a, b) -> Integer.compare(b.count(), a.count()));
        return topSourcesLimit > 0 && ranked.size() > topSourcesLimit
                ? ranked.subList(0, topSourcesLimit)
                : ranked;
    }

    /**
     * The key a record is attributed to: its source location, otherwise the function of the outermost
     * frame that has one.
     *
     * @param record The record.
     * @return The key, empty if the record has neither.
     */
    public static Optional<String> sourceKey(IssueRecord record) {
        if (record.sourceLocation() != null) {
            return Optional.of(record.sourceLocation().toString());
        }
        return record.primaryFunction();
    }

    /**
     * Totals over the three leak categories.
     *
     * @param statistics The statistics to summarize.
     * @return The leak summary.
     */
    public LeakSummary leakSummary(Statistics statistics) {
        long bytes = 0;
        long blocks = 0;
        int issues = 0;
        Map<IssueType, Long> bytesByLeakType = new EnumMap<>(IssueType.class);
        for (IssueType type : IssueType.values()) {
            if (!type.isLeak()) {
                continue;
            }
            bytes += statistics.bytesByType().get(type);
            blocks += statistics.blocksByType().get(type);
            issues += statistics.issuesByType().get(type);
            bytesByLeakType.put(type, statistics.bytesByType().get(type));
        }
        return new LeakSummary(bytes, blocks, issues, share(bytes, statistics.totalBytes()), bytesByLeakType);
    }

    /**
     * Frequency and impact per source key, in first-seen order. Records without any source are
     * attributed to {@link #UNKNOWN_SOURCE}.
     *
     * @param classified The grouping.
     * @return One entry per distinct source.
     */
    public List<SourceAnalysis> sourceAnalysis(ClassifiedIssues classified) {
        Map<String, SourceAccumulator> bySource = new LinkedHashMap<>();
        for (IssueRecord record : classified.inEncounterOrder()) {
            String key = sourceKey(record).orElse(UNKNOWN_SOURCE);
            bySource.computeIfAbsent(key, k -> new SourceAccumulator()).add(record);
        }
        return bySource.entrySet().stream()
                .map(e -> e.getValue().toAnalysis(e.getKey()))
                .collect(Collectors.toList());
    }

    private static double share(long part, long total) {
        return total == 0 ? 0.0 : (double) part / total;
    }

    private static final class SourceAccumulator {
        private int count;
        private long bytes;
        private long blocks;
        private final Set<IssueType> types = EnumSet.noneOf(IssueType.class);
        private final Set<IssueSeverity> severities = EnumSet.noneOf(IssueSeverity.class);

        void add(IssueRecord record) {
            count++;
            bytes += record.bytesCount();
            blocks += record.blocksCount();
            types.add(record.issueType());
            severities.add(record.severityLevel());
        }

        SourceAnalysis toAnalysis(String source) {
            return new SourceAnalysis(source, count, bytes, blocks, types, severities);
        }
    }
}
