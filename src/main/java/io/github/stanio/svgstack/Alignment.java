/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import java.util.Locale;

/**
 * Item alignment flags.  Horizontal and vertical flags combine
 * independently.  No flag for an axis stretches the item to fill its box
 * along that axis.
 */
public final class Alignment {

    public static final int FILL = 0;

    public static final int LEFT = 0x01;
    public static final int RIGHT = 0x02;
    public static final int HCENTER = 0x04;

    public static final int TOP = 0x20;
    public static final int BOTTOM = 0x40;
    public static final int VCENTER = 0x80;

    public static final int CENTER = HCENTER | VCENTER;

    static final int HORIZONTAL_MASK = LEFT | RIGHT | HCENTER;
    static final int VERTICAL_MASK = TOP | BOTTOM | VCENTER;

    private Alignment() {/* no instances */}

    /**
     * Parses {@code |}, {@code ,}, or {@code +} separated flag names:
     * {@code left}, {@code right}, {@code hcenter}, {@code top},
     * {@code bottom}, {@code vcenter}, {@code center}, {@code fill}.
     *
     * @param   names  flag names
     * @return  the combined flags
     * @throws  IllegalArgumentException  if an unknown name is given
     */
    public static int parse(String names) {
        int flags = FILL;
        for (String item : names.split("[|,+]")) {
            String name = item.strip().toLowerCase(Locale.ROOT);
            switch (name) {
            case "left":    flags |= LEFT; break;
            case "right":   flags |= RIGHT; break;
            case "hcenter": flags |= HCENTER; break;
            case "top":     flags |= TOP; break;
            case "bottom":  flags |= BOTTOM; break;
            case "vcenter": flags |= VCENTER; break;
            case "center":  flags |= CENTER; break;
            case "":
            case "fill":
                break;
            default:
                throw new IllegalArgumentException("Unknown alignment: " + item);
            }
        }
        return flags;
    }

}
