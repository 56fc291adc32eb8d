package org.leakscope.parser.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One memory issue assembled from a single contiguous header and frames block.
 * Records are immutable and never merged or split after creation.
 *
 * @param sequence The zero-based encounter order of this record among the emitted records of one run.
 * @param lineNumber The 1-based line number of the header in the input.
 * @param issueType The classified issue type.
 * @param bytesCount The canonical byte count (total, not the parenthetical breakdown).
 * @param blocksCount The canonical block count.
 * @param byteBreakdown The verbatim parenthetical breakdown, e.g. {@code 16 direct, 56 indirect}, or {@code null}.
 * @param lossRecordId The tool's loss record reference, e.g. {@code 5 of 12}; empty when the header had none.
 * @param stackTrace The primary trace, outermost (closest to the fault) first.
 * @param addressDescription The first continuation line describing the faulting address, or {@code null}.
 * @param auxiliaryTrace Frames that followed a continuation line, e.g. where a block was freed or allocated.
 * @param sourceLocation The best available source location of the primary trace, or {@code null}.
 * @param severity The severity rank, higher is more severe; see {@link #severityRank(IssueType, long)}.
 */
public record IssueRecord(
        int sequence,
        int lineNumber,
        IssueType issueType,
        long bytesCount,
        long blocksCount,
        String byteBreakdown,
        String lossRecordId,
        List<StackFrame> stackTrace,
        String addressDescription,
        List<StackFrame> auxiliaryTrace,
        SourceLocation sourceLocation,
        int severity
) {

    public IssueRecord {
        Objects.requireNonNull(issueType, "issueType");
        if (bytesCount < 0 || blocksCount < 0) {
            throw new IllegalArgumentException("Byte and block counts must be non-negative");
        }
        lossRecordId = lossRecordId == null ? "" : lossRecordId;
        stackTrace = stackTrace == null ? List.of() : List.copyOf(stackTrace);
        auxiliaryTrace = auxiliaryTrace == null ? List.of() : List.copyOf(auxiliaryTrace);
    }

    public Optional<SourceLocation> location() {
        return Optional.ofNullable(sourceLocation);
    }

    public Optional<String> breakdown() {
        return Optional.ofNullable(byteBreakdown);
    }

    public IssueSeverity severityLevel() {
        return issueType.severityLevel();
    }

    /**
     * @return the function name of the outermost frame that has one.
     */
    public Optional<String> primaryFunction() {
        return stackTrace.stream()
                .map(StackFrame::functionName)
                .filter(Objects::nonNull)
                .findFirst();
    }

    /**
     * Ranks a record by its type's criticality first and the magnitude (bit length) of its byte
     * count second, so any definite leak outranks any reachable block regardless of size.
     *
     * @param type The issue type.
     * @param bytesCount The canonical byte count, non-negative.
     * @return The severity rank, higher is more severe.
     */
    public static int severityRank(IssueType type, long bytesCount) {
        return type.criticality() * Long.SIZE + (Long.SIZE - Long.numberOfLeadingZeros(bytesCount));
    }

    /**
     * Derives the best available source location of a trace: the first frame with a file and a line,
     * otherwise the first frame with a file only.
     *
     * @param trace The trace, outermost first.
     * @return The location, or {@code null} if no frame carries one.
     */
    public static SourceLocation deriveSourceLocation(List<StackFrame> trace) {
        SourceLocation fileOnly = null;
        for (StackFrame frame : trace) {
            Optional<SourceLocation> loc = frame.sourceLocation();
            if (loc.isEmpty()) {
                continue;
            }
            if (loc.get().hasLineNumber()) {
                return loc.get();
            }
            if (fileOnly == null) {
                fileOnly = loc.get();
            }
        }
        return fileOnly;
    }
}
