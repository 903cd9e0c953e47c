/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgstack.svg.SVGSource;

/**
 * Lines up items along a main axis, similar to Qt's {@code QBoxLayout}:
 * <pre>
 * margin | item | spacing | item | spacing | item | margin</pre>
 * <p>
 * The cross-axis size is the largest item's, plus the margin on both
 * sides.  When the layout is given a larger box than its natural size,
 * the extra main-axis length is distributed among the items proportionally
 * to their stretch factors.  If all stretch factors are zero, the last item
 * gets all of it.</p>
 * <p>
 * Each item gets a box of its main-axis length, and the full cross-axis
 * length.  The item fills the box along an axis it has no alignment flag
 * for; otherwise it keeps its size and is aligned within the box.</p>
 *
 * @see  Alignment
 */
public class BoxLayout extends LayoutItem {

    static final Logger log = Logger.getLogger(BoxLayout.class.getName());

    static final String LAYOUT_BOX = "fill: none; stroke: black; stroke-width: 2;";

    private final Direction direction;

    private final List<Entry> entries = new ArrayList<>();

    private double contentsMargins;

    private double spacing;

    public BoxLayout(Direction direction) {
        this.direction = direction;
    }

    public static BoxLayout horizontal() {
        return new BoxLayout(Direction.LEFT_TO_RIGHT);
    }

    public static BoxLayout vertical() {
        return new BoxLayout(Direction.TOP_TO_BOTTOM);
    }

    public Direction direction() {
        return direction;
    }

    public double spacing() {
        return spacing;
    }

    /**
     * Sets the space between consecutive items.
     */
    public void setSpacing(double spacing) {
        this.spacing = requireNonNegative(spacing, "spacing");
    }

    public double contentsMargins() {
        return contentsMargins;
    }

    /**
     * Sets the margin around the items, on all sides.
     */
    public void setContentsMargins(double margins) {
        this.contentsMargins = requireNonNegative(margins, "margins");
    }

    private static double requireNonNegative(double value, String name) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " should be a finite"
                                               + " non-negative number: " + value);
        }
        return value;
    }

    public FlowLeaf addSVG(SVGSource source) {
        return addSVG(source, 0, Alignment.FILL, null);
    }

    public FlowLeaf addSVG(SVGSource source, double stretch, int alignment) {
        return addSVG(source, stretch, alignment, null);
    }

    /**
     * Adds a source document sized and positioned by this layout.
     *
     * @param   source  the source document
     * @param   stretch  stretch factor
     * @param   alignment  {@link Alignment} flags
     * @param   xml  markup to draw over the item, or {@code null}
     * @return  the added leaf
     * @throws  IllegalArgumentException  if {@code stretch} is negative, or
     *          {@code xml} is not well-formed
     */
    public FlowLeaf addSVG(SVGSource source, double stretch, int alignment, String xml) {
        FlowLeaf leaf = new FlowLeaf(source);
        addSVG(leaf, stretch, alignment, xml);
        return leaf;
    }

    public void addSVG(FlowLeaf leaf, double stretch, int alignment, String xml) {
        addEntry(leaf, stretch, alignment, xml);
    }

    public FixedLeaf addSVGNoLayout(SVGSource source, double x, double y) {
        return addSVGNoLayout(source, x, y, null);
    }

    /**
     * Adds a source document at the given offset from the origin of this
     * layout.  The item doesn't affect the size of the layout, or the
     * position of other items.
     *
     * @param   source  the source document
     * @param   x  horizontal offset
     * @param   y  vertical offset
     * @param   xml  markup to draw over the item, or {@code null}
     * @return  the added leaf
     */
    public FixedLeaf addSVGNoLayout(SVGSource source, double x, double y, String xml) {
        FixedLeaf leaf = new FixedLeaf(source, x, y);
        addSVGNoLayout(leaf, xml);
        return leaf;
    }

    public void addSVGNoLayout(FixedLeaf leaf, String xml) {
        addEntry(leaf, 0, Alignment.FILL, xml);
    }

    /**
     * Adds a nested layout.  Nested layouts always fill their box.
     *
     * @param   layout  the layout to add
     * @param   stretch  stretch factor
     * @throws  IllegalArgumentException  if the layout has already been
     *          added, or this layout is nested in it
     */
    public void addLayout(BoxLayout layout, double stretch) {
        for (BoxLayout ancestor = this;
                ancestor != null; ancestor = ancestor.parent()) {
            if (ancestor == layout) {
                throw new IllegalArgumentException("Can't add " + layout
                                                   + " to itself, or its own descendant");
            }
        }
        addEntry(layout, stretch, Alignment.FILL, null);
    }

    private void addEntry(LayoutItem item, double stretch, int alignment, String xml) {
        requireNonNegative(stretch, "stretch");
        Decoration decoration = (xml == null) ? null : Decoration.parse(xml);
        item.attachTo(this);
        entries.add(new Entry(item, stretch, alignment, decoration));
    }

    public List<LayoutItem> items() {
        List<LayoutItem> items = new ArrayList<>(entries.size());
        entries.forEach(entry -> items.add(entry.item));
        return Collections.unmodifiableList(items);
    }

    @Override
    public Size measure(Size minSize) {
        return arrange(minSize).size;
    }

    /*
     * Measures the natural size of the flowed items, then distributes
     * any extra length given by minSize.
     */
    private Arrangement arrange(Size minSize) {
        final int count = entries.size();
        double[] lengths = new double[count];
        double total = 0;
        double maxCross = 0;
        double totalStretch = 0;
        int flowedCount = 0;
        int lastFlowed = -1;
        for (int i = 0; i < count; i++) {
            Entry entry = entries.get(i);
            if (!entry.item.isFlowed())
                continue;

            Size itemSize = entry.item.measure(null);
            lengths[i] = direction.main(itemSize);
            total += lengths[i];
            maxCross = Math.max(maxCross, direction.cross(itemSize));
            totalStretch += entry.stretch;
            flowedCount += 1;
            lastFlowed = i;
        }
        if (flowedCount > 1) {
            total += spacing * (flowedCount - 1);
        }
        total += 2 * contentsMargins;

        double innerCross = maxCross;
        double slack = 0;
        if (minSize != null) {
            innerCross = Math.max(innerCross,
                    direction.cross(minSize) - 2 * contentsMargins);
            slack = Math.max(0, direction.main(minSize) - total);
        }

        if (slack > 0 && lastFlowed >= 0) {
            if (totalStretch > 0) {
                for (int i = 0; i < count; i++) {
                    Entry entry = entries.get(i);
                    if (entry.item.isFlowed()) {
                        lengths[i] += slack * entry.stretch / totalStretch;
                    }
                }
            } else {
                lengths[lastFlowed] += slack;
            }
        }

        Size size = direction.size(total + slack, innerCross + 2 * contentsMargins);
        return new Arrangement(size, innerCross, lengths);
    }

    @Override
    void place(Rectangle2D box, Placement placement) {
        Arrangement arrangement = arrange(Size.of(box));
        Size size = arrangement.size;
        placement.put(this, new Rectangle2D.Double(box.getX(), box.getY(),
                                                   size.width(), size.height()));
        log.fine(() -> this + " at " + box.getX() + "," + box.getY() + ": " + size);

        boolean horizontal = direction.isHorizontal();
        double mainOrigin = horizontal ? box.getX() : box.getY();
        double crossOrigin = (horizontal ? box.getY() : box.getX()) + contentsMargins;
        double mainSize = direction.main(size);

        double cursor = contentsMargins;
        boolean first = true;
        for (int i = 0, len = entries.size(); i < len; i++) {
            Entry entry = entries.get(i);
            if (!entry.item.isFlowed()) {
                entry.item.place(box, placement);
                continue;
            }

            if (first) {
                first = false;
            } else {
                cursor += spacing;
            }

            // Advance by the allotted length, whatever the item ends up with.
            double length = arrangement.lengths[i];
            double mainPosition = mainOrigin + (direction.isReversed()
                                                ? mainSize - cursor - length
                                                : cursor);
            Size allotted = direction.size(length, arrangement.innerCross);
            Rectangle2D itemBox = horizontal
                    ? new Rectangle2D.Double(mainPosition, crossOrigin,
                                             allotted.width(), allotted.height())
                    : new Rectangle2D.Double(crossOrigin, mainPosition,
                                             allotted.width(), allotted.height());

            Size itemSize = entry.item.measure(allotted);
            entry.item.place(align(itemBox, itemSize, entry.alignment), placement);
            cursor += length;
        }
    }

    static Rectangle2D align(Rectangle2D box, Size itemSize, int alignment) {
        double x = box.getX();
        double width = itemSize.width();
        if ((alignment & Alignment.LEFT) != 0) {
            // x = box.getX()
        } else if ((alignment & Alignment.RIGHT) != 0) {
            x += box.getWidth() - width;
        } else if ((alignment & Alignment.HCENTER) != 0) {
            x += (box.getWidth() - width) / 2;
        } else {
            width = box.getWidth();
        }

        double y = box.getY();
        double height = itemSize.height();
        if ((alignment & Alignment.TOP) != 0) {
            // y = box.getY()
        } else if ((alignment & Alignment.BOTTOM) != 0) {
            y += box.getHeight() - height;
        } else if ((alignment & Alignment.VCENTER) != 0) {
            y += (box.getHeight() - height) / 2;
        } else {
            height = box.getHeight();
        }
        return new Rectangle2D.Double(x, y, width, height);
    }

    /**
     * Computes the final bounds of this layout in its natural size, at the
     * origin, and all the items nested in it.
     *
     * @return  the final bounds of all items
     */
    public Placement computePlacement() {
        Size size = measure(null);
        Placement placement = new Placement();
        place(new Rectangle2D.Double(0, 0, size.width(), size.height()), placement);
        return placement;
    }

    /**
     * Lays out this layout in its natural size, and registers all the
     * nested leaves with the given accumulator, in order.  Sets the size of
     * the accumulator to the size of this layout.
     *
     * @param   accumulator  receives the placed leaves
     * @param   debugBoxes  whether to draw outlines around layout boxes
     *          and leaves
     * @return  the size of this layout
     */
    public Size render(LayoutAccumulator accumulator, boolean debugBoxes) {
        Placement placement = computePlacement();
        Size size = placement.size(this);
        accumulator.setSize(size);
        collect(placement, accumulator, debugBoxes);
        return size;
    }

    @Override
    void collect(Placement placement, LayoutAccumulator accumulator, boolean debugBoxes) {
        if (debugBoxes) {
            accumulator.addDebugBox(placement.bounds(this), LAYOUT_BOX);
        }
        for (Entry entry : entries) {
            entry.item.collect(placement, accumulator, debugBoxes);
            if (entry.decoration != null) {
                accumulator.addDecoration(entry.decoration,
                                          placement.position(entry.item));
            }
        }
    }

    @Override
    public String toString() {
        return "BoxLayout(" + direction + ", " + entries.size() + " items)";
    }


    private static final class Entry {
        final LayoutItem item;
        final double stretch;
        final int alignment;
        final Decoration decoration;

        Entry(LayoutItem item, double stretch, int alignment, Decoration decoration) {
            this.item = item;
            this.stretch = stretch;
            this.alignment = alignment;
            this.decoration = decoration;
        }
    }


    private static final class Arrangement {
        final Size size;
        final double innerCross;
        final double[] lengths;

        Arrangement(Size size, double innerCross, double[] lengths) {
            this.size = size;
            this.innerCross = innerCross;
            this.lengths = lengths;
        }
    }


} // class BoxLayout
