/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import java.util.Locale;

/**
 * {@code BoxLayout} main axis and flow direction.  Items are always
 * painted in the order they have been added, regardless of the direction.
 */
public enum Direction {

    LEFT_TO_RIGHT(true, false),
    RIGHT_TO_LEFT(true, true),
    TOP_TO_BOTTOM(false, false),
    BOTTOM_TO_TOP(false, true);

    private final boolean horizontal;
    private final boolean reversed;

    private Direction(boolean horizontal, boolean reversed) {
        this.horizontal = horizontal;
        this.reversed = reversed;
    }

    public boolean isHorizontal() {
        return horizontal;
    }

    public boolean isReversed() {
        return reversed;
    }

    double main(Size size) {
        return horizontal ? size.width() : size.height();
    }

    double cross(Size size) {
        return horizontal ? size.height() : size.width();
    }

    Size size(double main, double cross) {
        return horizontal ? new Size(main, cross)
                          : new Size(cross, main);
    }

    /**
     * Accepts {@code h[orizontal]}, {@code ltr}, {@code rtl},
     * {@code v[ertical]}, {@code ttb}, {@code btt}, and the constant names,
     * ignoring case.
     */
    public static Direction parse(String name) {
        String value = name.strip().toLowerCase(Locale.ROOT);
        switch (value) {
        case "ltr":
        case "left_to_right":
            return LEFT_TO_RIGHT;
        case "rtl":
        case "right_to_left":
            return RIGHT_TO_LEFT;
        case "ttb":
        case "top_to_bottom":
            return TOP_TO_BOTTOM;
        case "btt":
        case "bottom_to_top":
            return BOTTOM_TO_TOP;
        default:
            if (!value.isEmpty() && "horizontal".startsWith(value))
                return LEFT_TO_RIGHT;
            if (!value.isEmpty() && "vertical".startsWith(value))
                return TOP_TO_BOTTOM;
            throw new IllegalArgumentException("Unknown direction: " + name);
        }
    }

}
