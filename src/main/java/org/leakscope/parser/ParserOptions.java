package org.leakscope.parser;

import com.typesafe.config.Config;
import org.leakscope.parser.frontend.patterns.LinePatternLibrary;

/**
 * Tunables of the parser, read from the {@code parser} block of the application configuration.
 *
 * @param requireMemcheckHeader Whether a file must carry a {@code ==pid== Memcheck,} banner.
 * @param headerScanLines How many leading lines are searched for the banner.
 * @param wordBreakLookahead How many following lines may be joined to recover a broken header.
 */
public record ParserOptions(boolean requireMemcheckHeader, int headerScanLines, int wordBreakLookahead) {

    private static final String REQUIRE_HEADER_KEY = "require-memcheck-header";
    private static final String HEADER_SCAN_LINES_KEY = "header-scan-lines";
    private static final String WORD_BREAK_LOOKAHEAD_KEY = "word-break-lookahead";

    public ParserOptions {
        if (headerScanLines < 1) {
            throw new IllegalArgumentException("header-scan-lines must be positive, was " + headerScanLines);
        }
        if (wordBreakLookahead < 0 || wordBreakLookahead > LinePatternLibrary.MAX_WORD_BREAK_LOOKAHEAD) {
            throw new IllegalArgumentException("word-break-lookahead must be within [0, "
                    + LinePatternLibrary.MAX_WORD_BREAK_LOOKAHEAD + "], was " + wordBreakLookahead);
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(true, 50, LinePatternLibrary.DEFAULT_WORD_BREAK_LOOKAHEAD);
    }

    /**
     * @param parserConfig The {@code parser} configuration block; missing keys fall back to defaults.
     * @return The options.
     */
    public static ParserOptions fromConfig(Config parserConfig) {
        ParserOptions defaults = defaults();
        return new ParserOptions(
                parserConfig.hasPath(REQUIRE_HEADER_KEY)
                        ? parserConfig.getBoolean(REQUIRE_HEADER_KEY) : defaults.requireMemcheckHeader(),
                parserConfig.hasPath(HEADER_SCAN_LINES_KEY)
                        ? parserConfig.getInt(HEADER_SCAN_LINES_KEY) : defaults.headerScanLines(),
                parserConfig.hasPath(WORD_BREAK_LOOKAHEAD_KEY)
                        ? parserConfig.getInt(WORD_BREAK_LOOKAHEAD_KEY) : defaults.wordBreakLookahead());
    }
}
