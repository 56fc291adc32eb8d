package org.leakscope.parser.frontend.patterns;

/**
 * A count token reduced to its canonical total.
 *
 * @param value The leading number outside any parentheses.
 * @param annotation The verbatim parenthetical text, e.g. {@code 16 direct, 56 indirect}, or {@code null}.
 */
public record NormalizedNumber(long value, String annotation) {
}
