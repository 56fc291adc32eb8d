package org.leakscope.parser;

import org.leakscope.parser.api.ILogParser;
import org.leakscope.parser.api.IssueRecord;
import org.leakscope.parser.api.LogParseException;
import org.leakscope.parser.api.ParseResult;
import org.leakscope.parser.diagnostics.DiagnosticsEngine;
import org.leakscope.parser.frontend.assembler.IssueAssembler;
import org.leakscope.parser.frontend.patterns.LinePatternLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The main parser implementation. It reads a Memcheck log, runs the assembler over its lines
 * and packages the records with the collected diagnostics.
 * <p>
 * Each call to {@link #parse(List, String)} is an independent run with its own diagnostics;
 * instances hold no per-run state and can be shared.
 */
public class LogParser implements ILogParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(LogParser.class);
    private static final Pattern MEMCHECK_BANNER = Pattern.compile("==\\d+==\\s+Memcheck,");

    private final ParserOptions options;
    private final LinePatternLibrary patterns;

    public LogParser() {
        this(ParserOptions.defaults());
    }

    /**
     * @param options The parser tunables.
     */
    public LogParser(ParserOptions options) {
        this.options = options;
        this.patterns = new LinePatternLibrary(options.wordBreakLookahead());
    }

    @Override
    public ParseResult parse(List<String> lines, String sourceName) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        IssueAssembler assembler = new IssueAssembler(patterns, diagnostics);
        List<IssueRecord> records = assembler.assemble(lines);
        LOGGER.debug("Parsed {}: {} records, {} diagnostics", sourceName, records.size(), diagnostics.getWarnings().size());
        return new ParseResult(sourceName, records, diagnostics.getWarnings(), assembler.getLinesConsumed());
    }

    @Override
    public ParseResult parseFile(Path logFile) throws LogParseException {
        List<String> lines = readLines(logFile);
        if (!lines.isEmpty() && options.requireMemcheckHeader()) {
            validateMemcheckFormat(lines, logFile);
        }
        return parse(lines, logFile.toString());
    }

    /**
     * Reads a log file as UTF-8, replacing malformed input instead of failing.
     *
     * @param logFile The file to read.
     * @return The physical lines.
     * @throws LogParseException if the path is missing, not a regular file, or unreadable.
     */
    List<String> readLines(Path logFile) throws LogParseException {
        if (!Files.exists(logFile)) {
            throw new LogParseException("File does not exist: " + logFile);
        }
        if (!Files.isRegularFile(logFile)) {
            throw new LogParseException("Path is not a file: " + logFile);
        }
        if (!Files.isReadable(logFile)) {
            throw new LogParseException("File is not readable: " + logFile);
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(logFile), decoder))) {
            return reader.lines().collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new LogParseException("Error reading file: " + logFile, e);
        }
    }

    private void validateMemcheckFormat(List<String> lines, Path logFile) throws LogParseException {
        int limit = Math.min(lines.size(), options.headerScanLines());
        for (int i = 0; i < limit; i++) {
            if (MEMCHECK_BANNER.matcher(lines.get(i)).find()) {
                return;
            }
        }
        throw new LogParseException(String.format(
                "%s does not appear to be a Valgrind Memcheck log: no Memcheck banner within the first %d lines",
                logFile, options.headerScanLines()));
    }
}
