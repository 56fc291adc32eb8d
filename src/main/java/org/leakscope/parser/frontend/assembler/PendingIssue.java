package org.leakscope.parser.frontend.assembler;

import org.leakscope.parser.api.IssueRecord;
import org.leakscope.parser.api.IssueType;
import org.leakscope.parser.api.StackFrame;
import org.leakscope.parser.frontend.patterns.HeaderMatch;
import org.leakscope.parser.frontend.patterns.NormalizedNumber;

import java.util.ArrayList;
import java.util.List;

/**
 * The mutable record under construction while the assembler is {@link AssemblerState#IN_TRACE}.
 * Not thread-safe; owned by a single assembler.
 */
final class PendingIssue {

    private final int lineNumber;
    private final HeaderMatch header;
    private final NormalizedNumber bytes;
    private final long blocks;
    private final List<StackFrame> frames = new ArrayList<>();
    private final List<StackFrame> auxiliaryFrames = new ArrayList<>();
    private String addressDescription;
    private boolean afterContinuation;
    private boolean freedBlock;

    PendingIssue(int lineNumber, HeaderMatch header, NormalizedNumber bytes, long blocks) {
        this.lineNumber = lineNumber;
        this.header = header;
        this.bytes = bytes;
        this.blocks = blocks;
    }

    void addFrame(StackFrame frame) {
        if (afterContinuation) {
            auxiliaryFrames.add(frame);
        } else {
            frames.add(frame);
        }
    }

    void addContinuation(String content, boolean describesFreedBlock) {
        if (addressDescription == null) {
            addressDescription = content;
        }
        freedBlock |= describesFreedBlock;
        afterContinuation = true;
    }

    int frameCount() {
        return frames.size();
    }

    int lineNumber() {
        return lineNumber;
    }

    /**
     * Freezes this pending issue. An invalid access inside a freed block becomes a use after free.
     *
     * @param sequence The encounter index among emitted records.
     * @return The immutable record.
     */
    IssueRecord close(int sequence) {
        IssueType type = header.issueType();
        if (freedBlock && (type == IssueType.INVALID_READ || type == IssueType.INVALID_WRITE)) {
            type = IssueType.USE_AFTER_FREE;
        }
        return new IssueRecord(
                sequence,
                lineNumber,
                type,
                bytes.value(),
                blocks,
                bytes.annotation(),
                header.lossRecordId(),
                frames,
                addressDescription,
                auxiliaryFrames,
                IssueRecord.deriveSourceLocation(frames),
                IssueRecord.severityRank(type, bytes.value()));
    }
}
