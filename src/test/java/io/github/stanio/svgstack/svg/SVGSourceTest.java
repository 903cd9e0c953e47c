/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack.svg;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.awt.geom.Rectangle2D;
import java.net.URISyntaxException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestInstance.Lifecycle;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@TestInstance(Lifecycle.PER_CLASS)
class SVGSourceTest {

    private static String svg(String rootAttributes) {
        return "<svg xmlns=\"" + SVGNamespaces.SVG + "\" " + rootAttributes + "/>";
    }

    static Path resource(String name) throws URISyntaxException {
        return Path.of(SVGSourceTest.class.getResource(name).toURI());
    }

    @Test
    void loadFile() throws Exception {
        SVGSource source = SVGSource.load(resource("figure.svg"));

        assertThat(source.name()).endsWith("figure.svg");
        assertThat(source.width()).isCloseTo(50 * 96 / 25.4, within(1e-9));
        assertThat(source.height()).isCloseTo(25 * 96 / 25.4, within(1e-9));
        assertThat(source.viewBox()).contains(new Rectangle2D.Double(0, 0, 200, 100));
        assertThat(source.root().getLocalName()).isEqualTo("svg");
    }

    @Test
    void sizeFromViewBox() throws Exception {
        SVGSource source = SVGSource.fromString(svg("viewBox=\"-5 -5 40.5 20\""), "svglite");

        assertThat(source.width()).isEqualTo(40.5);
        assertThat(source.height()).isEqualTo(20);
        assertThat(source.viewBox()).contains(new Rectangle2D.Double(-5, -5, 40.5, 20));
    }

    @Test
    void widthAndHeightOverViewBox() throws Exception {
        SVGSource source = SVGSource.fromString(svg("width=\"10\" height=\"20\""
                                                    + " viewBox=\"0 0 100 200\""), "a");

        assertThat(source.width()).isEqualTo(10);
        assertThat(source.height()).isEqualTo(20);
    }

    @Test
    void viewBoxIsCopied() throws Exception {
        SVGSource source = SVGSource.fromString(svg("viewBox=\"0 0 10 10\""), "a");

        source.viewBox().get().setRect(1, 1, 1, 1);

        assertThat(source.viewBox()).contains(new Rectangle2D.Double(0, 0, 10, 10));
    }

    @Test
    void noSize() {
        assertThatThrownBy(() -> SVGSource.fromString(svg("width=\"10\""), "partial"))
                .isInstanceOf(SVGFormatException.class)
                .hasMessageStartingWith("partial: ");
    }

    @Test
    void unsupportedUnit() {
        assertThatThrownBy(() -> SVGSource.fromString(svg("width=\"100%\" height=\"100%\""), "a"))
                .isInstanceOf(SVGFormatException.class)
                .hasMessageContaining("Unsupported unit");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "width=\"-50\" height=\"20\"",
        "width=\"10\" height=\"-1mm\"",
        "width=\"1e400\" height=\"10\" viewBox=\"0 0 10 10\""
    })
    void unusableSize(String rootAttributes) {
        assertThatThrownBy(() -> SVGSource.fromString(svg(rootAttributes), "bad-size"))
                .isInstanceOf(SVGFormatException.class)
                .hasMessageStartingWith("bad-size: ")
                .hasMessageContaining("finite non-negative");
    }

    @Test
    void zeroSize() throws Exception {
        SVGSource source = SVGSource.fromString(svg("width=\"0\" height=\"0\""), "empty");

        assertThat(source.width()).isZero();
        assertThat(source.height()).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = { "0 0 10", "0 0 10 x", "0 0 0 10", "0 0 10 -1", "0 0 1e400 10" })
    void malformedViewBox(String viewBox) {
        assertThatThrownBy(() -> SVGSource.fromString(svg("viewBox=\"" + viewBox + "\""), "a"))
                .isInstanceOf(SVGFormatException.class)
                .hasMessageContaining("viewBox");
    }

    @Test
    void notSVG() {
        assertThatThrownBy(() -> SVGSource.fromString("<svg width=\"10\" height=\"10\"/>", "plain"))
                .as("no namespace")
                .isInstanceOf(SVGFormatException.class)
                .hasMessageContaining("expected root element");
        assertThatThrownBy(() -> SVGSource.fromString("<svg", "broken"))
                .as("not well-formed")
                .isInstanceOf(SVGFormatException.class)
                .hasMessageStartingWith("broken: ");
    }

}
