/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import java.util.IdentityHashMap;
import java.util.Map;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;

/**
 * Final position and size of every item of a layout tree, keyed by item
 * identity.  Produced by a single placement pass; an item is placed at most
 * once per pass.
 *
 * @see  BoxLayout#computePlacement()
 */
public class Placement {

    private final Map<LayoutItem, Rectangle2D> bounds = new IdentityHashMap<>();

    void put(LayoutItem item, Rectangle2D itemBounds) {
        Rectangle2D previous = bounds.putIfAbsent(item,
                new Rectangle2D.Double(itemBounds.getX(), itemBounds.getY(),
                                       itemBounds.getWidth(), itemBounds.getHeight()));
        if (previous != null) {
            throw new IllegalStateException(item + " already placed at " + previous);
        }
    }

    public boolean contains(LayoutItem item) {
        return bounds.containsKey(item);
    }

    /**
     * {@return the bounds of the given item}
     *
     * @throws  IllegalArgumentException  if the item has not been placed
     */
    public Rectangle2D bounds(LayoutItem item) {
        Rectangle2D itemBounds = bounds.get(item);
        if (itemBounds == null) {
            throw new IllegalArgumentException("Not placed: " + item);
        }
        return (Rectangle2D) itemBounds.clone();
    }

    public Point2D position(LayoutItem item) {
        Rectangle2D itemBounds = bounds(item);
        return new Point2D.Double(itemBounds.getX(), itemBounds.getY());
    }

    public Size size(LayoutItem item) {
        return Size.of(bounds(item));
    }

    public int size() {
        return bounds.size();
    }

}
