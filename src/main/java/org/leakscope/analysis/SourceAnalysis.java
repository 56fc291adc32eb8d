package org.leakscope.analysis;

import org.leakscope.parser.api.IssueSeverity;
import org.leakscope.parser.api.IssueType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Frequency and impact of one source across all records.
 *
 * @param source The source key, {@code Unknown} for records without location or function.
 * @param count The number of records.
 * @param totalBytes Their summed bytes.
 * @param totalBlocks Their summed blocks.
 * @param issueTypes The issue types seen at this source.
 * @param severities The severity levels seen at this source.
 */
public record SourceAnalysis(
        String source,
        int count,
        long totalBytes,
        long totalBlocks,
        Set<IssueType> issueTypes,
        Set<IssueSeverity> severities
) {
    public SourceAnalysis {
        issueTypes = issueTypes.isEmpty()
                ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(issueTypes));
        severities = severities.isEmpty()
                ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(severities));
    }
}
