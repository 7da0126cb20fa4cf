package com.phillippitts.shato.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class NumberFormatsTest {

    @Test
    void dropsTrailingZeroOfIntegralDoubles() {
        assertThat(NumberFormats.plain(5.0)).isEqualTo("5");
        assertThat(NumberFormats.plain(-90.0)).isEqualTo("-90");
        assertThat(NumberFormats.plain(100.0)).isEqualTo("100");
    }

    @Test
    void keepsFractions() {
        assertThat(NumberFormats.plain(10.5)).isEqualTo("10.5");
        assertThat(NumberFormats.plain(0.25)).isEqualTo("0.25");
    }

    @Test
    void neverUsesExponentNotation() {
        assertThat(NumberFormats.plain(1.0e7)).isEqualTo("10000000");
        assertThat(NumberFormats.plain(new BigDecimal("1E+3"))).isEqualTo("1000");
    }

    @Test
    void formatsIntegersAsIs() {
        assertThat(NumberFormats.plain(7)).isEqualTo("7");
        assertThat(NumberFormats.plain(-1L)).isEqualTo("-1");
    }

    @Test
    void handlesNull() {
        assertThat(NumberFormats.plain(null)).isEqualTo("null");
    }
}
