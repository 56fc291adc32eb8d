package org.leakscope.parser.frontend.patterns;

/**
 * A header found at a given line, possibly re-joined from several physical lines.
 *
 * @param header The recognized header fields.
 * @param linesConsumed The number of physical lines the header spans, at least 1.
 * @param text The (joined) header text the match was made on.
 */
public record ResolvedHeader(HeaderMatch header, int linesConsumed, String text) {

    /**
     * @return true if the header was recovered from a word-broken line.
     */
    public boolean isRecovered() {
        return linesConsumed > 1;
    }
}
