package org.leakscope.parser.frontend.patterns;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link NumberNormalizer}.
 */
@Tag("unit")
class NumberNormalizerTest {

    @Test
    void normalize_removesThousandsSeparators() throws MalformedNumberException {
        assertThat(NumberNormalizer.normalize("1,204")).isEqualTo(1204L);
        assertThat(NumberNormalizer.normalize("1,048,576")).isEqualTo(1_048_576L);
        assertThat(NumberNormalizer.normalize("0")).isZero();
    }

    @Test
    void parse_usesLeadingTotalAndKeepsBreakdownAsAnnotation() throws MalformedNumberException {
        // When
        NormalizedNumber number = NumberNormalizer.parse("72 (16 direct, 56 indirect)");

        // Then
        assertThat(number.value()).isEqualTo(72L);
        assertThat(number.annotation()).isEqualTo("16 direct, 56 indirect");
    }

    @Test
    void parse_withoutParenthetical_hasNoAnnotation() throws MalformedNumberException {
        assertThat(NumberNormalizer.parse("40").annotation()).isNull();
    }

    @Test
    void normalize_ignoresDigitsInsideParentheses() throws MalformedNumberException {
        assertThat(NumberNormalizer.normalize("(3 direct) 9")).isEqualTo(9L);
    }

    @Test
    void normalize_rejectsTokenWithoutDigits() {
        assertThatThrownBy(() -> NumberNormalizer.normalize(",,,"))
                .isInstanceOf(MalformedNumberException.class)
                .satisfies(e -> assertThat(((MalformedNumberException) e).getToken()).isEqualTo(",,,"));
    }

    @Test
    void normalize_rejectsOverflowingValue() {
        assertThatThrownBy(() -> NumberNormalizer.normalize("99,999,999,999,999,999,999"))
                .isInstanceOf(MalformedNumberException.class);
    }

    @Test
    void normalize_rejectsEmptyToken() {
        assertThatThrownBy(() -> NumberNormalizer.normalize(""))
                .isInstanceOf(MalformedNumberException.class);
    }

    @Test
    void normalize_rejectsNull() {
        assertThatThrownBy(() -> NumberNormalizer.normalize(null))
                .isInstanceOf(MalformedNumberException.class);
    }
}
