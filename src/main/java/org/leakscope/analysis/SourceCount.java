package org.leakscope.analysis;

/**
 * How often one source (a location or a function) appears across all records.
 *
 * @param source The source key, e.g. {@code test.c:12} or {@code main}.
 * @param count The number of records attributed to it.
 */
public record SourceCount(String source, int count) {
}
