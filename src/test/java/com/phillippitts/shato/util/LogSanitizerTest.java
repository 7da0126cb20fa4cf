package com.phillippitts.shato.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.preview(null, 10)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.preview("move to 5 7", 0)).isEmpty();
        assertThat(LogSanitizer.preview("move to 5 7", -1)).isEmpty();
    }

    @Test
    void shouldKeepShortTextUnchanged() {
        assertThat(LogSanitizer.preview("rotate left", 20)).isEqualTo("rotate left");
    }

    @Test
    void shouldMarkCutWithEllipsis() {
        assertThat(LogSanitizer.preview("patrol the bedrooms twice", 10)).isEqualTo("patrol ...");
        assertThat(LogSanitizer.preview("patrol the bedrooms twice", 10)).hasSize(10);
    }

    @Test
    void shouldCutWithoutEllipsisWhenMaxIsTiny() {
        assertThat(LogSanitizer.preview("hello", 2)).isEqualTo("he");
    }

    @Test
    void shouldFlattenLineBreaks() {
        assertThat(LogSanitizer.preview("go home\n\nPrevious error: bad\r\nx", 100))
                .isEqualTo("go home Previous error: bad x");
    }
}
