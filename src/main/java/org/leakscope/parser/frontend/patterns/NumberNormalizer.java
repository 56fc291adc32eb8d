package org.leakscope.parser.frontend.patterns;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses count tokens such as {@code 1,204} or {@code 72 (16 direct, 56 indirect)} into canonical integers.
 * <p>
 * The canonical value is the leading number outside parentheses. Parenthetical sub-totals are
 * informational and only kept verbatim as an annotation. This class is stateless and thread-safe.
 */
public final class NumberNormalizer {

    private static final Pattern PARENTHETICAL = Pattern.compile("\\(([^()]*)\\)");
    private static final Pattern GROUPED_DIGITS = Pattern.compile("\\d[\\d,]*");

    private NumberNormalizer() {}

    /**
     * Returns the canonical value of a count token.
     *
     * @param token The token, possibly comma-grouped and possibly followed by a parenthetical breakdown.
     * @return The canonical non-negative total.
     * @throws MalformedNumberException if no digit sequence can be extracted or the value overflows.
     */
    public static long normalize(String token) throws MalformedNumberException {
        return parse(token).value();
    }

    /**
     * Like {@link #normalize(String)} but also keeps the parenthetical annotation.
     *
     * @param token The token to parse.
     * @return The canonical value and the annotation, if any.
     * @throws MalformedNumberException if no digit sequence can be extracted or the value overflows.
     */
    public static NormalizedNumber parse(String token) throws MalformedNumberException {
        if (token == null) {
            throw new MalformedNumberException("null", "no token");
        }

        String annotation = null;
        Matcher paren = PARENTHETICAL.matcher(token);
        if (paren.find()) {
            annotation = paren.group(1).strip();
        }
        String outside = PARENTHETICAL.matcher(token).replaceAll(" ");

        Matcher digits = GROUPED_DIGITS.matcher(outside);
        if (!digits.find()) {
            throw new MalformedNumberException(token, "no digit sequence");
        }
        String plain = digits.group().replace(",", "");
        try {
            return new NormalizedNumber(Long.parseLong(plain), annotation);
        } catch (NumberFormatException e) {
            throw new MalformedNumberException(token, "value out of range", e);
        }
    }
}
