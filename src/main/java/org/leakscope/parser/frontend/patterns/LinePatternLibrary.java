package org.leakscope.parser.frontend.patterns;

import org.leakscope.parser.api.IssueType;
import org.leakscope.parser.api.SourceLocation;
import org.leakscope.parser.api.StackFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * The fixed set of recognizers applied to single physical lines of a Memcheck log.
 * <p>
 * The textual shapes overlap, so the checks are order-sensitive: summary lines are tested
 * before headers, and headers before frames. All recognizers work on line <em>content</em>,
 * i.e. the line with its {@code ==pid==} prefix removed (see {@link #stripPrefix(String)}).
 * <p>
 * Instances are immutable and thread-safe.
 */
public class LinePatternLibrary {

    /** Default number of following lines joined when recovering a word-broken header. */
    public static final int DEFAULT_WORD_BREAK_LOOKAHEAD = 2;
    /** Upper bound for the word-break window, each extra line doubles the join candidates. */
    public static final int MAX_WORD_BREAK_LOOKAHEAD = 5;

    private static final Logger LOGGER = LoggerFactory.getLogger(LinePatternLibrary.class);

    private static final String UNKNOWN_SYMBOL = "???";

    private static final Pattern PID_PREFIX = Pattern.compile("^\\s*==\\d+==");

    private static final Pattern SUMMARY = Pattern.compile(
            "^(?:(?:LEAK|HEAP|ERROR)\\s+SUMMARY\\b"
                    + "|(?:definitely|indirectly|possibly)\\s+lost\\s*:"
                    + "|still\\s+reachable\\s*:"
                    + "|suppressed\\s*:"
                    + "|in\\s+use\\s+at\\s+exit\\s*:"
                    + "|total\\s+heap\\s+usage\\s*:"
                    + "|All\\s+heap\\s+blocks\\s+were\\s+freed)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LEAK_HEADER = Pattern.compile(
            "^(?<bytes>[\\d,]+)(?:\\s*\\((?<breakdown>[^)]*)\\))?\\s+bytes?\\s+in\\s+(?<blocks>[\\d,]+)\\s+blocks?"
                    + "\\s+are\\s+(?<verdict>.+?)(?:\\s+in\\s+loss\\s+record\\s+(?<record>.+?))?\\s*$",
            Pattern.CASE_INSENSITIVE);

    // Tolerates the misspellings the tool's older releases and line editors produce.
    private static final Pattern DEFINITELY_LOST = Pattern.compile("definit(?:e?l)?y\\s+lost", Pattern.CASE_INSENSITIVE);
    private static final Pattern POSSIBLY_LOST = Pattern.compile("possib(?:i?l)?y\\s+lost", Pattern.CASE_INSENSITIVE);
    private static final Pattern STILL_REACHABLE = Pattern.compile("still\\s+reachabl?e", Pattern.CASE_INSENSITIVE);

    private static final Pattern INVALID_ACCESS = Pattern.compile(
            "^Invalid\\s+(?<kind>read|write)\\s+of\\s+size\\s+(?<size>[\\d,]+)(?:\\s.*)?$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern GENERIC_ERROR = Pattern.compile(
            "^(?:Invalid\\s+(?:free|alignment|size)\\b"
                    + "|Mismatched\\s+free\\b"
                    + "|Conditional\\s+jump\\s+or\\s+move\\b"
                    + "|Use\\s+of\\s+uninitialised\\s+value\\b"
                    + "|Syscall\\s+param\\b"
                    + "|Source\\s+and\\s+destination\\s+overlap\\b"
                    + "|Argument\\s+'[^']*'\\s+of\\s+function\\s+\\S+\\s+has\\s+a\\s+fishy\\b).*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SIZE_CLAUSE = Pattern.compile("\\bof\\s+size\\s+([\\d,]+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern LEAK_FRAGMENT = Pattern.compile("^[\\d,]+\\s*(?:\\(.*|b.*)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INVALID_FRAGMENT = Pattern.compile("^Inv[a-z]*(?:\\s.*)?$", Pattern.CASE_INSENSITIVE);

    private static final Pattern FRAME = Pattern.compile(
            "^(?i:at|by)\\s+(?<address>0x[0-9A-Fa-f]+)(?:\\s*:\\s*(?<desc>.*))?\\s*$");
    private static final Pattern TRAILING_PARENTHETICAL = Pattern.compile("^(?<function>.*?)\\s*\\((?<info>[^()]*)\\)\\s*$");
    private static final Pattern SOURCE_IN_DESCRIPTION = Pattern.compile("\\((?<file>[^()]+?):(?<line>\\d{1,9})\\s*\\)\\s*$");
    private static final Pattern COMPLETE_LOSS_RECORD = Pattern.compile("^[\\d,]+\\s+of\\s+[\\d,]+$", Pattern.CASE_INSENSITIVE);

    private static final Pattern CONTINUATION = Pattern.compile(
            "^(?:Address\\s+0x[0-9A-Fa-f]+\\s+is\\b"
                    + "|Block\\s+was\\s+alloc'd\\s+at\\b"
                    + "|Uninitialised\\s+value\\s+was\\s+created\\b)");
    private static final Pattern FREED_BLOCK = Pattern.compile(
            "^Address\\s+0x[0-9A-Fa-f]+\\s+is\\s+[\\d,]+\\s+bytes\\s+inside\\s+a\\s+block\\s+of\\s+size\\s+[\\d,]+\\s+free'd");

    private final int wordBreakLookahead;

    /**
     * Creates a library with the default word-break window.
     */
    public LinePatternLibrary() {
        this(DEFAULT_WORD_BREAK_LOOKAHEAD);
    }

    /**
     * @param wordBreakLookahead How many following lines may be joined to recover a broken header.
     *                           Clamped to {@code [0, MAX_WORD_BREAK_LOOKAHEAD]}; 0 disables recovery.
     */
    public LinePatternLibrary(int wordBreakLookahead) {
        this.wordBreakLookahead = Math.max(0, Math.min(MAX_WORD_BREAK_LOOKAHEAD, wordBreakLookahead));
    }

    public int getWordBreakLookahead() {
        return wordBreakLookahead;
    }

    /**
     * Removes the {@code ==pid==} prefix and surrounding whitespace.
     * @param rawLine A physical line of the log.
     * @return The line content, empty for separator lines.
     */
    public String stripPrefix(String rawLine) {
        if (rawLine == null) {
            return "";
        }
        Matcher m = PID_PREFIX.matcher(rawLine);
        String content = m.find() ? rawLine.substring(m.end()) : rawLine;
        return content.strip();
    }

    /**
     * @param content Line content.
     * @return true if the line is an aggregate total over the whole run.
     */
    public boolean isSummary(String content) {
        return SUMMARY.matcher(content).find();
    }

    /**
     * Matches a single line against the header shapes. Summary lines never match.
     *
     * @param content Line content.
     * @return The header fields, if the line is an issue header.
     */
    public Optional<HeaderMatch> matchHeader(String content) {
        if (content.isEmpty() || isSummary(content)) {
            return Optional.empty();
        }

        Matcher leak = LEAK_HEADER.matcher(content);
        if (leak.matches()) {
            String verdict = leak.group("verdict").strip();
            IssueType type = leakTypeOf(verdict);
            String bytes = leak.group("bytes");
            if (leak.group("breakdown") != null) {
                bytes = bytes + " (" + leak.group("breakdown").strip() + ")";
            }
            String record = leak.group("record") == null ? "" : leak.group("record").strip();
            return Optional.of(new HeaderMatch(
                    type != null ? type : IssueType.OTHER, type != null, verdict, bytes, leak.group("blocks"), record));
        }

        Matcher access = INVALID_ACCESS.matcher(content);
        if (access.matches()) {
            IssueType type = "read".equalsIgnoreCase(access.group("kind")) ? IssueType.INVALID_READ : IssueType.INVALID_WRITE;
            return Optional.of(new HeaderMatch(type, true, content, access.group("size"), "1", ""));
        }

        if (GENERIC_ERROR.matcher(content).matches()) {
            Matcher size = SIZE_CLAUSE.matcher(content);
            if (size.find()) {
                return Optional.of(new HeaderMatch(IssueType.OTHER, false, content, size.group(1), "1", ""));
            }
            return Optional.of(new HeaderMatch(IssueType.OTHER, false, content, "0", "0", ""));
        }
        return Optional.empty();
    }

    /**
     * Resolves the header starting at {@code index}, re-joining word-broken lines if needed.
     * <p>
     * A known leak header whose loss record reference is cut off (e.g. {@code 5 o}) is completed
     * from the following lines when the join keeps the verdict.
     * <p>
     * Tie-breaking: a single-line header with a known verdict wins; otherwise a recovered header
     * with a known verdict; otherwise the single-line header with an unknown verdict; otherwise a
     * recovered header with an unknown verdict.
     *
     * @param lines All physical lines of the input.
     * @param index The index of the line to resolve.
     * @return The header and the number of lines it spans, if any.
     */
    public Optional<ResolvedHeader> resolveHeader(List<String> lines, int index) {
        String content = stripPrefix(lines.get(index));
        Optional<HeaderMatch> direct = matchHeader(content);
        if (direct.isPresent() && direct.get().knownVerdict()) {
            HeaderMatch header = direct.get();
            if (wordBreakLookahead > 0 && hasTruncatedLossRecord(header)) {
                Optional<ResolvedHeader> completed = recoverWordBreak(lines, index, content,
                        m -> m.issueType() == header.issueType() && hasCompleteLossRecord(m), false);
                if (completed.isPresent()) {
                    return completed;
                }
            }
            return Optional.of(new ResolvedHeader(header, 1, content));
        }
        if (wordBreakLookahead > 0 && isHeaderFragment(content)) {
            Optional<ResolvedHeader> recovered = recoverWordBreak(lines, index, content, HeaderMatch::knownVerdict, direct.isEmpty());
            if (recovered.isPresent()) {
                return recovered;
            }
        }
        return direct.map(h -> new ResolvedHeader(h, 1, content));
    }

    /**
     * @param content Line content.
     * @return true if the line begins like a header: a count followed by a byte word, or {@code Invalid}.
     */
    public boolean isHeaderFragment(String content) {
        return !content.isEmpty()
                && (LEAK_FRAGMENT.matcher(content).matches() || INVALID_FRAGMENT.matcher(content).matches());
    }

    private static boolean hasTruncatedLossRecord(HeaderMatch header) {
        return header.issueType().isLeak()
                && !header.lossRecordId().isEmpty()
                && !hasCompleteLossRecord(header);
    }

    private static boolean hasCompleteLossRecord(HeaderMatch header) {
        return COMPLETE_LOSS_RECORD.matcher(header.lossRecordId()).matches();
    }

    private Optional<ResolvedHeader> recoverWordBreak(List<String> lines, int index, String content,
                                                      Predicate<HeaderMatch> accept, boolean acceptUnknownVerdict) {
        List<String> candidates = List.of(content);
        ResolvedHeader fallback = null;

        for (int k = 1; k <= wordBreakLookahead && index + k < lines.size(); k++) {
            String next = stripPrefix(lines.get(index + k));
            if (next.isEmpty() || isSummary(next) || FRAME.matcher(next).matches()
                    || isContinuation(next) || startsKnownHeader(next)) {
                break;
            }

            List<String> joined = new ArrayList<>(candidates.size() * 2);
            for (String candidate : candidates) {
                joined.add(candidate + next);
                joined.add(candidate + " " + next);
            }
            for (String text : joined) {
                Optional<HeaderMatch> match = matchHeader(text);
                if (match.isEmpty()) {
                    continue;
                }
                if (accept.test(match.get())) {
                    LOGGER.debug("Recovered word-broken header at line {} from {} lines: {}", index + 1, k + 1, text);
                    return Optional.of(new ResolvedHeader(match.get(), k + 1, text));
                }
                if (acceptUnknownVerdict && !match.get().knownVerdict() && fallback == null) {
                    fallback = new ResolvedHeader(match.get(), k + 1, text);
                }
            }
            candidates = joined;
        }
        return Optional.ofNullable(fallback);
    }

    private boolean startsKnownHeader(String content) {
        return matchHeader(content).map(HeaderMatch::knownVerdict).orElse(false);
    }

    /**
     * Matches an {@code at/by} stack frame line.
     *
     * @param content Line content.
     * @return The frame, if the line is a frame; address-only frames are valid.
     */
    public Optional<StackFrame> matchFrame(String content) {
        Matcher m = FRAME.matcher(content);
        if (!m.matches()) {
            return Optional.empty();
        }
        String address = m.group("address");
        String description = m.group("desc") == null ? "" : m.group("desc").strip();

        String function = description;
        String library = null;
        String file = null;
        Integer line = null;

        Matcher paren = TRAILING_PARENTHETICAL.matcher(description);
        if (paren.matches() && !paren.group("function").isBlank()) {
            function = paren.group("function");
            String info = paren.group("info").strip();
            if (info.startsWith("in ")) {
                library = info.substring(3).strip();
            } else {
                Optional<SourceLocation> location = matchSourceLocation(description);
                if (location.isPresent()) {
                    file = location.get().file();
                    line = location.get().lineNumber();
                } else if (!info.isEmpty() && !UNKNOWN_SYMBOL.equals(info)) {
                    file = info;
                }
            }
        }
        if (UNKNOWN_SYMBOL.equals(function)) {
            function = null;
        }
        return Optional.of(new StackFrame(address, function, library, file, line));
    }

    /**
     * Extracts a trailing {@code (file:line)} from a frame description.
     *
     * @param description The frame description, e.g. {@code main (test.c:10)}.
     * @return The location, if present.
     */
    public Optional<SourceLocation> matchSourceLocation(String description) {
        Matcher m = SOURCE_IN_DESCRIPTION.matcher(description);
        if (!m.find() || m.group("file").isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new SourceLocation(m.group("file").strip(), Integer.parseInt(m.group("line"))));
    }

    /**
     * @param content Line content.
     * @return true if the line extends the current record without being a frame,
     *         e.g. {@code Address 0x.. is 8 bytes inside a block of size 40 free'd}.
     */
    public boolean isContinuation(String content) {
        return CONTINUATION.matcher(content).find();
    }

    /**
     * @param continuation A continuation line content.
     * @return true if it describes an access inside an already freed block.
     */
    public boolean describesFreedBlock(String continuation) {
        return FREED_BLOCK.matcher(continuation).find();
    }

    private static IssueType leakTypeOf(String verdict) {
        if (DEFINITELY_LOST.matcher(verdict).matches()) {
            return IssueType.DEFINITELY_LOST;
        }
        if (POSSIBLY_LOST.matcher(verdict).matches()) {
            return IssueType.POSSIBLY_LOST;
        }
        if (STILL_REACHABLE.matcher(verdict).matches()) {
            return IssueType.STILL_REACHABLE;
        }
        return null;
    }
}
