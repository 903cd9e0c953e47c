/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack.svg;

import java.io.IOException;

/**
 * Signals a source document that is well-formed XML, but not usable as
 * an SVG stack item: missing/foreign root element, no usable size,
 * malformed {@code viewBox}, unsupported length unit.  Also used for XML
 * parse errors vs. errors reading the data.
 */
public class SVGFormatException extends IOException {

    private static final long serialVersionUID = 3412779583109206117L;

    public SVGFormatException(String message) {
        super(message);
    }

    public SVGFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    static SVGFormatException of(String source, String message) {
        return new SVGFormatException(source + ": " + message);
    }

}
