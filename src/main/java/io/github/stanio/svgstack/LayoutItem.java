/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import java.awt.geom.Rectangle2D;

/**
 * A node of the layout tree: a {@link BoxLayout}, a {@link FlowLeaf}, or a
 * {@link FixedLeaf}.  The layout and render passes visit all of them
 * through the same three operations:
 * <ol>
 * <li>{@link #measure(Size)} &ndash; side-effect free, repeatable;</li>
 * <li>{@link #place(Rectangle2D, Placement)} &ndash; records the final
 *     bounds into a {@code Placement}, never into the item;</li>
 * <li>{@link #collect(Placement, LayoutAccumulator, boolean)} &ndash;
 *     registers the placed leaves for the composition.</li>
 * </ol>
 * <p>
 * An item may be added to a single layout entry only.</p>
 */
public abstract class LayoutItem {

    private BoxLayout parent;

    LayoutItem() {
        // package-private
    }

    final BoxLayout parent() {
        return parent;
    }

    void attachTo(BoxLayout layout) {
        if (parent != null) {
            throw new IllegalArgumentException(this + " already added to a layout");
        }
        parent = layout;
    }

    /**
     * Whether this item takes part in the size and position computation of
     * its containing layout.
     */
    boolean isFlowed() {
        return true;
    }

    /**
     * Computes the size of this item given a minimum (target) size.
     *
     * @param   minSize  the minimum size, or {@code null} for the natural size
     * @return  the computed size
     */
    public abstract Size measure(Size minSize);

    /**
     * Records the final bounds of this item (and nested items) given the
     * box computed by the containing layout.
     *
     * @param  box  the final box, or for items not participating in the
     *         layout the box of the containing layout
     * @param  placement  receives the final bounds
     */
    abstract void place(Rectangle2D box, Placement placement);

    abstract void collect(Placement placement,
                          LayoutAccumulator accumulator,
                          boolean debugBoxes);

}
