package org.leakscope.parser.frontend.assembler;

import org.leakscope.parser.api.IssueRecord;
import org.leakscope.parser.api.StackFrame;
import org.leakscope.parser.diagnostics.DiagnosticsSink;
import org.leakscope.parser.diagnostics.ParseWarning;
import org.leakscope.parser.diagnostics.ReasonCode;
import org.leakscope.parser.frontend.patterns.HeaderMatch;
import org.leakscope.parser.frontend.patterns.LinePatternLibrary;
import org.leakscope.parser.frontend.patterns.MalformedNumberException;
import org.leakscope.parser.frontend.patterns.NormalizedNumber;
import org.leakscope.parser.frontend.patterns.NumberNormalizer;
import org.leakscope.parser.frontend.patterns.ResolvedHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A single-pass scanner that groups each header line and its following frame lines into one
 * {@link IssueRecord}. The line roles come from the {@link LinePatternLibrary}; the state
 * changes come from the {@link AssemblerState} transition table.
 * <p>
 * The assembler can be fed incrementally with {@link #feed(List, int)} and abandoned at any
 * point: {@link #getClosedRecords()} always holds a valid, if incomplete, list. One instance
 * serves one input; it is not thread-safe.
 */
public class IssueAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(IssueAssembler.class);

    private final LinePatternLibrary patterns;
    private final DiagnosticsSink diagnostics;
    private final List<IssueRecord> closed = new ArrayList<>();
    private AssemblerState state = AssemblerState.SCANNING;
    private PendingIssue pending;
    private int linesConsumed;

    /**
     * @param patterns The line recognizers.
     * @param diagnostics Where recoverable problems are reported.
     */
    public IssueAssembler(LinePatternLibrary patterns, DiagnosticsSink diagnostics) {
        this.patterns = patterns;
        this.diagnostics = diagnostics;
    }

    /**
     * Runs the whole pass over the input and closes any pending record at the end.
     *
     * @param lines The physical lines of the log.
     * @return The closed records in encounter order.
     */
    public List<IssueRecord> assemble(List<String> lines) {
        if (lines.isEmpty()) {
            diagnostics.report(new ParseWarning(ParseWarning.Level.INFO, ReasonCode.EMPTY_INPUT,
                    "Input contains no lines", 0, ""));
        }
        int index = linesConsumed;
        while (index < lines.size()) {
            index += feed(lines, index);
        }
        finish();
        LOGGER.debug("Assembled {} records from {} lines", closed.size(), linesConsumed);
        return getClosedRecords();
    }

    /**
     * Processes the line at {@code index}. A word-broken header may consume more than one line.
     *
     * @param lines All physical lines of the input.
     * @param index The index of the next unconsumed line.
     * @return The number of lines consumed, at least 1.
     */
    public int feed(List<String> lines, int index) {
        if (state == AssemblerState.FINISHED) {
            throw new IllegalStateException("Assembler already reached end of input");
        }
        String raw = lines.get(index);
        String content = patterns.stripPrefix(raw);
        int lineNumber = index + 1;

        LineKind kind;
        ResolvedHeader header = null;
        StackFrame frame = null;
        if (content.isEmpty()) {
            kind = LineKind.SEPARATOR;
        } else if (patterns.isSummary(content)) {
            kind = LineKind.SUMMARY;
        } else {
            Optional<ResolvedHeader> resolved = patterns.resolveHeader(lines, index);
            if (resolved.isPresent()) {
                kind = LineKind.HEADER;
                header = resolved.get();
            } else {
                Optional<StackFrame> matched = patterns.matchFrame(content);
                if (matched.isPresent()) {
                    kind = LineKind.FRAME;
                    frame = matched.get();
                } else if (patterns.isContinuation(content)) {
                    kind = LineKind.CONTINUATION;
                } else {
                    kind = LineKind.TEXT;
                }
            }
        }

        Transition transition = state.on(kind);
        LOGGER.trace("line {}: {} {} -> {} ({})", lineNumber, state, kind, transition.target(), transition.action());
        state = transition.target();

        switch (transition.action()) {
            case OPEN:
                open(header, lineNumber, raw);
                break;
            case CLOSE_AND_OPEN:
                closePending();
                open(header, lineNumber, raw);
                break;
            case APPEND_FRAME:
                pending.addFrame(frame);
                break;
            case ATTACH_CONTINUATION:
                pending.addContinuation(content, patterns.describesFreedBlock(content));
                break;
            case CLOSE:
                closePending();
                break;
            case SKIP:
            default:
                break;
        }

        int consumed = header != null ? header.linesConsumed() : 1;
        linesConsumed = index + consumed;
        return consumed;
    }

    /**
     * Signals end of input. A record still open is emitted with whatever frames it collected.
     */
    public void finish() {
        if (state == AssemblerState.FINISHED) {
            return;
        }
        Transition transition = state.onEndOfInput();
        if (transition.action() == Transition.Action.CLOSE && pending != null) {
            diagnostics.report(new ParseWarning(ParseWarning.Level.INFO, ReasonCode.INCOMPLETE_TRACE,
                    "Input ended inside a trace; record closed with " + pending.frameCount() + " frame(s)",
                    pending.lineNumber(), ""));
            closePending();
        }
        state = transition.target();
    }

    private void open(ResolvedHeader resolved, int lineNumber, String raw) {
        HeaderMatch header = resolved.header();
        if (resolved.isRecovered()) {
            diagnostics.report(new ParseWarning(ParseWarning.Level.INFO, ReasonCode.WORD_BREAK_RECOVERED,
                    "Header re-joined from " + resolved.linesConsumed() + " lines", lineNumber, resolved.text()));
        }
        if (!header.knownVerdict()) {
            diagnostics.report(new ParseWarning(ParseWarning.Level.INFO, ReasonCode.UNRECOGNIZED_ISSUE_TYPE,
                    "Unrecognized issue verdict '" + header.verdict() + "', classified as OTHER", lineNumber, raw));
        }
        try {
            NormalizedNumber bytes = NumberNormalizer.parse(header.bytesToken());
            long blocks = NumberNormalizer.normalize(header.blocksToken());
            pending = new PendingIssue(lineNumber, header, bytes, blocks);
        } catch (MalformedNumberException e) {
            // The header's frames become orphans and are skipped while scanning.
            diagnostics.report(new ParseWarning(ParseWarning.Level.WARNING, ReasonCode.MALFORMED_NUMBER,
                    e.getMessage() + "; record dropped", lineNumber, raw));
            pending = null;
            state = AssemblerState.SCANNING;
        }
    }

    private void closePending() {
        if (pending == null) {
            return;
        }
        closed.add(pending.close(closed.size()));
        pending = null;
    }

    public AssemblerState getState() {
        return state;
    }

    /**
     * @return the records closed so far, in encounter order.
     */
    public List<IssueRecord> getClosedRecords() {
        return Collections.unmodifiableList(closed);
    }

    /**
     * @return the number of physical lines consumed so far.
     */
    public int getLinesConsumed() {
        return linesConsumed;
    }
}
