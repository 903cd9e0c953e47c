/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import static io.github.stanio.svgstack.svg.SVGLength.format;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

import io.github.stanio.svgstack.svg.SVGNamespaces;
import io.github.stanio.svgstack.svg.SVGSource;

final class TestSources {

    static final Map<String, String> NS = Map.of("svg", SVGNamespaces.SVG,
                                                 "xlink", SVGNamespaces.XLINK);

    private TestSources() {/* no instances */}

    static SVGSource svg(String name, double width, double height) {
        return svg(name, "width=\"" + format(width) + "\" height=\"" + format(height) + "\"",
                   "<rect width=\"" + format(width) + "\" height=\"" + format(height) + "\" />");
    }

    static SVGSource svg(String name, String rootAttributes, String content) {
        String xml = "<svg xmlns=\"" + SVGNamespaces.SVG + "\""
                + " xmlns:xlink=\"" + SVGNamespaces.XLINK + "\" "
                + rootAttributes + ">" + content + "</svg>";
        try {
            return SVGSource.fromString(xml, name);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

}
