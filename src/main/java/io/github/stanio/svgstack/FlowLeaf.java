/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import java.util.Locale;
import java.util.logging.Logger;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgstack.svg.SVGSource;

/**
 * A source document sized and positioned by the containing layout.
 */
public class FlowLeaf extends Leaf {

    static final Logger log = Logger.getLogger(FlowLeaf.class.getName());

    public FlowLeaf(SVGSource source) {
        super(source);
    }

    @Override
    void place(Rectangle2D box, Placement placement) {
        Size natural = naturalSize();
        if (box.getWidth() != natural.width()) {
            log.warning(() -> String.format(Locale.ROOT,
                    "Changing width of %s from %.2f to %.2f",
                    source().name(), natural.width(), box.getWidth()));
        }
        if (box.getHeight() != natural.height()) {
            log.warning(() -> String.format(Locale.ROOT,
                    "Changing height of %s from %.2f to %.2f",
                    source().name(), natural.height(), box.getHeight()));
        }
        placement.put(this, box);
    }

    @Override
    void collect(Placement placement, LayoutAccumulator accumulator, boolean debugBoxes) {
        accumulator.addFlowed(this, placement.bounds(this));
        if (debugBoxes) {
            accumulator.addDebugBox(placement.bounds(this), LayoutAccumulator.FLOW_LEAF_BOX);
        }
    }

    @Override
    public String toString() {
        return "FlowLeaf(" + source().name() + ")";
    }

}
