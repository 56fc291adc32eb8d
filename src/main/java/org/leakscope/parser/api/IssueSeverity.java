package org.leakscope.parser.api;

/**
 * Coarse severity buckets used for distribution statistics and report highlighting.
 */
public enum IssueSeverity {
    /** Leaks and memory corruption that must be fixed. */
    CRITICAL,
    /** Probable leaks. */
    HIGH,
    /** Issues of unknown impact. */
    MEDIUM,
    /** Benign retention. */
    LOW,
    /** Informational only. */
    INFO
}
