package org.leakscope.analysis;

import com.typesafe.config.ConfigFactory;
import org.leakscope.parser.api.IssueRecord;
import org.leakscope.parser.api.IssueSeverity;
import org.leakscope.parser.api.IssueType;
import org.leakscope.parser.api.StackFrame;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IssueClassifier} and the {@link ClassifiedIssues} views.
 */
@Tag("unit")
class IssueClassifierTest {

    private final IssueClassifier classifier = new IssueClassifier();

    @Test
    void classify_groupsByTypeKeepingEncounterOrder() {
        // Given
        List<IssueRecord> records = List.of(
                record(0, IssueType.DEFINITELY_LOST, 40, "a.c", 1),
                record(1, IssueType.INVALID_READ, 4, "b.c", 2),
                record(2, IssueType.DEFINITELY_LOST, 8, "c.c", 3));

        // When
        ClassifiedIssues classified = classifier.classify(records);

        // Then
        assertThat(classified.byType()).containsOnlyKeys(IssueType.values());
        assertThat(classified.get(IssueType.DEFINITELY_LOST)).extracting(IssueRecord::sequence).containsExactly(0, 2);
        assertThat(classified.get(IssueType.INVALID_READ)).hasSize(1);
        assertThat(classified.get(IssueType.STILL_REACHABLE)).isEmpty();
        assertThat(classified.size()).isEqualTo(3);
        assertThat(classified.inEncounterOrder()).containsExactlyElementsOf(records);
    }

    @Test
    void classify_isIdempotentOverFlattenedOutput() {
        List<IssueRecord> records = List.of(
                record(0, IssueType.POSSIBLY_LOST, 10, "a.c", 1),
                record(1, IssueType.OTHER, 0, null, null),
                record(2, IssueType.POSSIBLY_LOST, 20, "a.c", 1));

        ClassifiedIssues once = classifier.classify(records);
        ClassifiedIssues twice = classifier.classify(once.flatten());

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void computeStatistics_countsAndSumsPerType() {
        // Given
        ClassifiedIssues classified = classifier.classify(List.of(
                record(0, IssueType.DEFINITELY_LOST, 40, "a.c", 1),
                record(1, IssueType.DEFINITELY_LOST, 60, "a.c", 1),
                record(2, IssueType.STILL_REACHABLE, 100, "b.c", 2)));

        // When
        Statistics stats = classifier.computeStatistics(classified);

        // Then
        assertThat(stats.totalIssues()).isEqualTo(3);
        assertThat(stats.totalBytes()).isEqualTo(200L);
        assertThat(stats.totalBlocks()).isEqualTo(3L);
        assertThat(stats.issuesByType().get(IssueType.DEFINITELY_LOST)).isEqualTo(2);
        assertThat(stats.bytesByType().get(IssueType.DEFINITELY_LOST)).isEqualTo(100L);
        assertThat(stats.issuesByType().get(IssueType.INVALID_WRITE)).isZero();
        assertThat(stats.percentageByType().get(IssueType.DEFINITELY_LOST)).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(stats.bytePercentageByType().get(IssueType.STILL_REACHABLE)).isCloseTo(0.5, within(1e-9));
        assertThat(stats.severityDistribution().get(IssueSeverity.CRITICAL)).isEqualTo(2);
        assertThat(stats.severityDistribution().get(IssueSeverity.LOW)).isEqualTo(1);
    }

    @Test
    void computeStatistics_conservesCountsAndPercentagesSumToOne() {
        List<IssueRecord> records = new ArrayList<>();
        IssueType[] types = IssueType.values();
        for (int i = 0; i < 20; i++) {
            records.add(record(i, types[i % types.length], i * 3L, "f" + (i % 4) + ".c", i % 4 + 1));
        }

        Statistics stats = classifier.computeStatistics(classifier.classify(records));

        assertThat(stats.issuesByType().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(records.size());
        assertThat(stats.severityDistribution().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(records.size());
        assertThat(stats.percentageByType().values().stream().mapToDouble(Double::doubleValue).sum()).isCloseTo(1.0, within(1e-9));
        assertThat(stats.bytePercentageByType().values().stream().mapToDouble(Double::doubleValue).sum()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void computeStatistics_onEmptyInputIsZeroFilled() {
        Statistics stats = classifier.computeStatistics(ClassifiedIssues.empty());

        assertThat(stats.totalIssues()).isZero();
        assertThat(stats.issuesByType()).containsOnlyKeys(IssueType.values());
        assertThat(stats.percentageByType().values()).containsOnly(0.0);
        assertThat(stats.bytePercentageByType().values()).containsOnly(0.0);
        assertThat(stats.severityDistribution()).containsOnlyKeys(IssueSeverity.values());
        assertThat(stats.topSources()).isEmpty();
    }

    @Test
    void topSources_ranksByCountWithFirstSeenTieBreak() {
        // Given
        ClassifiedIssues classified = classifier.classify(List.of(
                record(0, IssueType.OTHER, 0, "z.c", 9),
                record(1, IssueType.OTHER, 0, "a.c", 1),
                record(2, IssueType.DEFINITELY_LOST, 8, "a.c", 1),
                record(3, IssueType.OTHER, 0, "m.c", 5),
                record(4, IssueType.OTHER, 0, null, null)));

        // When
        List<SourceCount> top = classifier.computeStatistics(classified).topSources();

        // Then
        assertThat(top).containsExactly(
                new SourceCount("a.c:1", 2),
                new SourceCount("z.c:9", 1),
                new SourceCount("m.c:5", 1));
    }

    @Test
    void topSources_fallsBackToFunctionAndHonorsLimit() {
        IssueClassifier limited = IssueClassifier.fromConfig(ConfigFactory.parseString("top-sources-limit = 1"));
        IssueRecord functionOnly = new IssueRecord(0, 1, IssueType.POSSIBLY_LOST, 8, 1, null, "1 of 2",
                List.of(new StackFrame("0x1", "alloc_buffer", "/lib/libx.so", null, null)),
                null, List.of(), null, IssueRecord.severityRank(IssueType.POSSIBLY_LOST, 8));
        IssueRecord withFile = record(1, IssueType.POSSIBLY_LOST, 8, "x.c", 3);

        List<SourceCount> top = limited.computeStatistics(limited.classify(List.of(functionOnly, withFile))).topSources();

        assertThat(top).containsExactly(new SourceCount("alloc_buffer", 1));
    }

    @Test
    void prioritized_ordersByCriticalityThenBytesThenSequence() {
        // Given
        IssueRecord reachable = record(0, IssueType.STILL_REACHABLE, 9000, "a.c", 1);
        IssueRecord smallLeak = record(1, IssueType.DEFINITELY_LOST, 8, "a.c", 2);
        IssueRecord bigLeak = record(2, IssueType.DEFINITELY_LOST, 800, "a.c", 3);
        IssueRecord sameLeak = record(3, IssueType.DEFINITELY_LOST, 800, "a.c", 4);
        IssueRecord write = record(4, IssueType.INVALID_WRITE, 4, "a.c", 5);

        // When
        ClassifiedIssues classified = classifier.classify(List.of(reachable, smallLeak, bigLeak, sameLeak, write));

        // Then
        assertThat(classified.prioritized()).containsExactly(bigLeak, sameLeak, smallLeak, write, reachable);
        assertThat(classified.criticalIssues()).containsExactly(bigLeak, sameLeak, smallLeak, write);
    }

    @Test
    void prioritized_ranksDefiniteLeakAboveLargeReachableBlock() {
        IssueRecord reachable = record(0, IssueType.STILL_REACHABLE, 1_000_000, "a.c", 1);
        IssueRecord leak = record(1, IssueType.DEFINITELY_LOST, 100, "b.c", 2);

        assertThat(classifier.classify(List.of(reachable, leak)).prioritized()).containsExactly(leak, reachable);
        assertThat(leak.severity()).isGreaterThan(reachable.severity());
    }

    @Test
    void severityRank_usesTypeFirstAndByteMagnitudeSecond() {
        assertThat(IssueRecord.severityRank(IssueType.DEFINITELY_LOST, 100))
                .isGreaterThan(IssueRecord.severityRank(IssueType.STILL_REACHABLE, Long.MAX_VALUE));
        assertThat(IssueRecord.severityRank(IssueType.DEFINITELY_LOST, 4096))
                .isGreaterThan(IssueRecord.severityRank(IssueType.DEFINITELY_LOST, 16));
        assertThat(IssueRecord.severityRank(IssueType.DEFINITELY_LOST, 16))
                .isEqualTo(IssueRecord.severityRank(IssueType.DEFINITELY_LOST, 16));
        assertThat(IssueRecord.severityRank(IssueType.OTHER, 0)).isEqualTo(IssueType.OTHER.criticality() * Long.SIZE);
    }

    @Test
    void leakSummary_coversOnlyLeakCategories() {
        ClassifiedIssues classified = classifier.classify(List.of(
                record(0, IssueType.DEFINITELY_LOST, 40, "a.c", 1),
                record(1, IssueType.POSSIBLY_LOST, 20, "a.c", 1),
                record(2, IssueType.INVALID_READ, 40, "b.c", 2)));

        LeakSummary summary = classifier.leakSummary(classifier.computeStatistics(classified));

        assertThat(summary.totalLeakedBytes()).isEqualTo(60L);
        assertThat(summary.totalLeakIssues()).isEqualTo(2);
        assertThat(summary.leakShareOfTotalBytes()).isCloseTo(0.6, within(1e-9));
        assertThat(summary.bytesByLeakType()).containsOnlyKeys(
                IssueType.DEFINITELY_LOST, IssueType.POSSIBLY_LOST, IssueType.STILL_REACHABLE);
    }

    @Test
    void sourceAnalysis_aggregatesPerSourceAndUsesUnknownFallback() {
        ClassifiedIssues classified = classifier.classify(List.of(
                record(0, IssueType.DEFINITELY_LOST, 40, "a.c", 1),
                record(1, IssueType.INVALID_WRITE, 4, "a.c", 1),
                record(2, IssueType.OTHER, 0, null, null)));

        List<SourceAnalysis> sources = classifier.sourceAnalysis(classified);

        assertThat(sources).extracting(SourceAnalysis::source).containsExactly("a.c:1", IssueClassifier.UNKNOWN_SOURCE);
        SourceAnalysis first = sources.get(0);
        assertThat(first.count()).isEqualTo(2);
        assertThat(first.totalBytes()).isEqualTo(44L);
        assertThat(first.issueTypes()).containsExactly(IssueType.DEFINITELY_LOST, IssueType.INVALID_WRITE);
        assertThat(first.severities()).containsExactly(IssueSeverity.CRITICAL);
    }

    @Test
    void constructor_rejectsNegativeLimit() {
        assertThatThrownBy(() -> new IssueClassifier(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    private static IssueRecord record(int sequence, IssueType type, long bytes, String file, Integer line) {
        List<StackFrame> trace = file == null
                ? List.of(StackFrame.addressOnly("0x" + Integer.toHexString(0x400000 + sequence)))
                : List.of(new StackFrame("0x4005" + sequence, "fn" + sequence, null, file, line));
        return new IssueRecord(sequence, sequence + 1, type, bytes, type == IssueType.OTHER ? 0 : 1, null,
                type.isLeak() ? (sequence + 1) + " of 99" : "", trace, null, List.of(),
                IssueRecord.deriveSourceLocation(trace), IssueRecord.severityRank(type, bytes));
    }
}
