package org.leakscope.analysis;

import org.leakscope.parser.api.IssueType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Totals over the three leak categories, excluding invalid accesses and other errors.
 *
 * @param totalLeakedBytes Bytes in definitely lost, possibly lost and still reachable records.
 * @param totalLeakedBlocks Blocks in those records.
 * @param totalLeakIssues The number of those records.
 * @param leakShareOfTotalBytes Leaked bytes as a fraction of all bytes, 0 when there are none.
 * @param bytesByLeakType Bytes per leak category.
 */
public record LeakSummary(
        long totalLeakedBytes,
        long totalLeakedBlocks,
        int totalLeakIssues,
        double leakShareOfTotalBytes,
        Map<IssueType, Long> bytesByLeakType
) {
    public LeakSummary {
        bytesByLeakType = Collections.unmodifiableMap(new EnumMap<>(bytesByLeakType));
    }
}
