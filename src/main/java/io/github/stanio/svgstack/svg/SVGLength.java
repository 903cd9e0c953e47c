/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack.svg;

import java.util.Locale;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts SVG/CSS absolute lengths to user units (pixels).
 *
 * @see  <a href="https://www.w3.org/TR/SVG11/coords.html#Units">Units</a>
 *       <i>(SVG 1.1)</i>
 * @see  <a href="https://www.w3.org/TR/css-values-3/#absolute-lengths">Absolute
 *       lengths</a> <i>(CSS Values and Units)</i>
 */
public final class SVGLength {

    static final Logger log = Logger.getLogger(SVGLength.class.getName());

    public static final double PX_PER_INCH = 96;

    private static final Pattern LENGTH;
    static {
        final String number = "[-+]? (?:\\d*\\.\\d+|\\d+\\.?) (?:e[-+]?\\d+)?";
        LENGTH = Pattern.compile("^\\s* (" + number + ") \\s* ([a-z%]*) \\s*$",
                                 Pattern.CASE_INSENSITIVE | Pattern.COMMENTS);
    }

    private SVGLength() {/* no instances */}

    /**
     * {@return the pixel value of the given length}  A length without a unit
     * is already in pixels.
     *
     * @param   value  number with an optional {@code px}, {@code pt},
     *          {@code in}, {@code mm}, or {@code cm} unit suffix
     * @throws  SVGFormatException  if {@code value} is not a number, or
     *          specifies a unit other than the supported ones
     */
    public static double toPixels(String value) throws SVGFormatException {
        Matcher m = LENGTH.matcher(value);
        if (!m.matches()) {
            throw new SVGFormatException("Not a length: \"" + value + '"');
        }

        double number = Double.parseDouble(m.group(1));
        String unit = m.group(2).toLowerCase(Locale.ROOT);
        double pixels = number * pixelsPerUnit(unit, value);
        log.fine(() -> value + " = " + pixels + " px");
        return pixels;
    }

    private static double pixelsPerUnit(String unit, String value)
            throws SVGFormatException {
        switch (unit) {
        case "":
        case "px":
            return 1;
        case "pt":
            return PX_PER_INCH / 72;
        case "in":
            return PX_PER_INCH;
        case "mm":
            return PX_PER_INCH / 25.4;
        case "cm":
            return PX_PER_INCH / 2.54;
        default:
            throw new SVGFormatException("Unsupported unit \""
                    + unit + "\": " + value);
        }
    }

    /**
     * Formats a number the shortest way: integral values without a
     * fraction part, others as {@link Double#toString(double)}.
     */
    public static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

}
