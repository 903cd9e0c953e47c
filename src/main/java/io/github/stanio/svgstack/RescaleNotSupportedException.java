/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

/**
 * The layout resizes a source that has no {@code viewBox} to scale its
 * content with.
 */
public class RescaleNotSupportedException extends CompositionException {

    private static final long serialVersionUID = -5372271680962357918L;

    public RescaleNotSupportedException(String source, Size natural, Size allotted) {
        super("Rescaling " + source + " from " + natural + " to " + allotted
                + " not supported without viewBox (hint: set alignment"
                + " or stretch on " + source + ")");
    }

}
