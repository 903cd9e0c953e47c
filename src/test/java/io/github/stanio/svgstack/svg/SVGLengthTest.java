/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack.svg;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class SVGLengthTest {

    @ParameterizedTest
    @CsvSource({
        "100,       100",
        "100px,     100",
        "' 12.5 ',  12.5",
        "72pt,      96",
        "1in,       96",
        "25.4mm,    96",
        "2.54cm,    96",
        "1.5e2,     150",
        "10PX,      10",
        ".5in,      48"
    })
    void toPixels(String value, double expected) throws Exception {
        assertThat(SVGLength.toPixels(value)).isCloseTo(expected, within(1e-9));
    }

    @ParameterizedTest
    @ValueSource(strings = { "100%", "10em", "5ex" })
    void unsupportedUnit(String value) {
        assertThatThrownBy(() -> SVGLength.toPixels(value))
                .isInstanceOf(SVGFormatException.class)
                .hasMessageStartingWith("Unsupported unit");
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "px", "auto", "1 2", "1..5" })
    void notALength(String value) {
        assertThatThrownBy(() -> SVGLength.toPixels(value))
                .isInstanceOf(SVGFormatException.class)
                .hasMessageStartingWith("Not a length");
    }

    @Test
    void format() {
        assertThat(SVGLength.format(110)).isEqualTo("110");
        assertThat(SVGLength.format(-20)).isEqualTo("-20");
        assertThat(SVGLength.format(27.5)).isEqualTo("27.5");
        assertThat(SVGLength.format(0.1)).isEqualTo("0.1");
    }

}
