package org.leakscope.parser.api;

import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface for turning Memcheck log text into issue records.
 */
public interface ILogParser {

    /**
     * Parses already decoded log lines. Never fails: unparseable fragments become warnings.
     *
     * @param lines The physical lines of the log, in order.
     * @param sourceName A name for the input, used in messages.
     * @return The records and warnings of this run.
     */
    ParseResult parse(List<String> lines, String sourceName);

    /**
     * Reads and parses a log file.
     *
     * @param logFile The path to the log file.
     * @return The records and warnings of this run.
     * @throws LogParseException if the file cannot be read or is not a Memcheck log.
     */
    ParseResult parseFile(Path logFile) throws LogParseException;
}
