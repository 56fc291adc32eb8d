package org.leakscope.parser.api;

/**
 * The closed set of memory issue categories recognized in a Memcheck log.
 * <p>
 * Each type carries a criticality rank used as the primary severity key:
 * leak certainty and memory corruption risk outweigh benign retention.
 * Higher values are more severe.
 */
public enum IssueType {
    /** Memory that is no longer referenced by any pointer. */
    DEFINITELY_LOST("Definitely Lost", 7, IssueSeverity.CRITICAL),
    /** A write to memory the program does not own. */
    INVALID_WRITE("Invalid Write", 6, IssueSeverity.CRITICAL),
    /** A read from memory the program does not own. */
    INVALID_READ("Invalid Read", 5, IssueSeverity.CRITICAL),
    /** An invalid access inside a block that was already freed. */
    USE_AFTER_FREE("Use After Free", 4, IssueSeverity.CRITICAL),
    /** Memory only referenced by interior pointers. */
    POSSIBLY_LOST("Possibly Lost", 3, IssueSeverity.HIGH),
    /** Memory still referenced at exit. */
    STILL_REACHABLE("Still Reachable", 2, IssueSeverity.LOW),
    /** Any other issue verdict, including verdicts this tool does not know. */
    OTHER("Other", 1, IssueSeverity.MEDIUM);

    private final String displayName;
    private final int criticality;
    private final IssueSeverity severityLevel;

    IssueType(String displayName, int criticality, IssueSeverity severityLevel) {
        this.displayName = displayName;
        this.criticality = criticality;
        this.severityLevel = severityLevel;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * @return the rank of this type in the severity order, higher is more severe.
     */
    public int criticality() {
        return criticality;
    }

    public IssueSeverity severityLevel() {
        return severityLevel;
    }

    /**
     * @return true for the three leak categories reported in loss records.
     */
    public boolean isLeak() {
        return this == DEFINITELY_LOST || this == POSSIBLY_LOST || this == STILL_REACHABLE;
    }
}
