package org.leakscope.analysis;

import org.leakscope.parser.api.IssueRecord;

import java.util.Comparator;

/**
 * The deterministic "critical issues first" order: issue type criticality descending, then byte
 * count descending, then original encounter order.
 */
public final class SeverityOrder {

    /** Orders the most severe record first. Total and consistent with record equality for one run. */
    public static final Comparator<IssueRecord> MOST_SEVERE_FIRST = Comparator
            .comparingInt(IssueRecord::severity).reversed()
            .thenComparing(Comparator.comparingLong(IssueRecord::bytesCount).reversed())
            .thenComparingInt(IssueRecord::sequence);

    private SeverityOrder() {}
}
