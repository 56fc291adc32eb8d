package org.leakscope.analysis;

import org.leakscope.parser.api.IssueRecord;
import org.leakscope.parser.api.IssueSeverity;
import org.leakscope.parser.api.IssueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Issue records grouped by type. Every {@link IssueType} has an entry, possibly empty, and
 * records keep their encounter order within a type.
 *
 * @param byType The read-only grouping.
 */
public record ClassifiedIssues(Map<IssueType, List<IssueRecord>> byType) {

    public ClassifiedIssues {
        EnumMap<IssueType, List<IssueRecord>> copy = new EnumMap<>(IssueType.class);
        for (IssueType type : IssueType.values()) {
            List<IssueRecord> records = byType.get(type);
            copy.put(type, records == null ? List.of() : List.copyOf(records));
        }
        byType = Collections.unmodifiableMap(copy);
    }

    public static ClassifiedIssues empty() {
        return new ClassifiedIssues(Map.of());
    }

    /**
     * @param type The issue type.
     * @return the records of that type in encounter order, never null.
     */
    public List<IssueRecord> get(IssueType type) {
        return byType.get(type);
    }

    public int size() {
        return byType.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * @return all records, grouped in {@link IssueType} declaration order.
     */
    public List<IssueRecord> flatten() {
        List<IssueRecord> all = new ArrayList<>(size());
        byType.values().forEach(all::addAll);
        return all;
    }

    /**
     * @return all records in their original encounter order.
     */
    public List<IssueRecord> inEncounterOrder() {
        List<IssueRecord> all = flatten();
        all.sort(Comparator.comparingInt(IssueRecord::sequence));
        return all;
    }

    /**
     * @return all records, most severe first.
     */
    public List<IssueRecord> prioritized() {
        List<IssueRecord> all = flatten();
        all.sort(SeverityOrder.MOST_SEVERE_FIRST);
        return all;
    }

    /**
     * @param type The issue type.
     * @return the records of that type, most severe first.
     */
    public List<IssueRecord> prioritized(IssueType type) {
        List<IssueRecord> records = new ArrayList<>(get(type));
        records.sort(SeverityOrder.MOST_SEVERE_FIRST);
        return records;
    }

    /**
     * @return the records at {@link IssueSeverity#CRITICAL} level, most severe first.
     */
    public List<IssueRecord> criticalIssues() {
        return prioritized().stream()
                .filter(r -> r.severityLevel() == IssueSeverity.CRITICAL)
                .collect(Collectors.toList());
    }
}
