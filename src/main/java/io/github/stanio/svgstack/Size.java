/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import static io.github.stanio.svgstack.svg.SVGLength.format;

import java.awt.geom.Rectangle2D;

/**
 * Width and height in pixels.
 */
public final class Size {

    public static final Size ZERO = new Size(0, 0);

    private final double width;
    private final double height;

    public Size(double width, double height) {
        this.width = width;
        this.height = height;
    }

    public static Size of(Rectangle2D bounds) {
        return new Size(bounds.getWidth(), bounds.getHeight());
    }

    public double width() {
        return width;
    }

    public double height() {
        return height;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(width) * 31 + Double.hashCode(height);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Size)) {
            return false;
        }
        Size other = (Size) obj;
        return Double.compare(width, other.width) == 0
                && Double.compare(height, other.height) == 0;
    }

    @Override
    public String toString() {
        return format(width) + "x" + format(height);
    }

}
