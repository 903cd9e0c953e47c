/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;

import io.github.stanio.svgstack.svg.SVGSource;

/**
 * A source document placed at a fixed offset from the containing layout's
 * origin, in its natural size.  Doesn't contribute to the layout size.
 */
public class FixedLeaf extends Leaf {

    private final double x;
    private final double y;

    public FixedLeaf(SVGSource source, double x, double y) {
        super(source);
        this.x = x;
        this.y = y;
    }

    public Point2D offset() {
        return new Point2D.Double(x, y);
    }

    @Override
    boolean isFlowed() {
        return false;
    }

    @Override
    public Size measure(Size minSize) {
        return Size.ZERO;
    }

    @Override
    void place(Rectangle2D box, Placement placement) {
        Size natural = naturalSize();
        placement.put(this, new Rectangle2D.Double(box.getX() + x, box.getY() + y,
                                                   natural.width(), natural.height()));
    }

    @Override
    void collect(Placement placement, LayoutAccumulator accumulator, boolean debugBoxes) {
        accumulator.addFixed(this, placement.bounds(this));
        if (debugBoxes) {
            accumulator.addDebugBox(placement.bounds(this), LayoutAccumulator.FIXED_LEAF_BOX);
        }
    }

    @Override
    public String toString() {
        return "FixedLeaf(" + source().name() + " @ " + x + "," + y + ")";
    }

}
