/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import static io.github.stanio.svgstack.svg.SVGLength.format;

import java.util.Optional;

import java.awt.geom.AffineTransform;
import java.awt.geom.Rectangle2D;

/**
 * Encapsulates the final bounds of a leaf and the transformation from the
 * leaf's own coordinate system to those bounds.
 */
public class BoxSizing {

    final Rectangle2D target;
    final AffineTransform transform;

    /**
     * Constructs a {@code BoxSizing} translating the leaf content to the
     * target position, without scaling.
     *
     * @param  target  final leaf bounds
     */
    public BoxSizing(Rectangle2D target) {
        this.target = (Rectangle2D) target.clone();
        this.transform = AffineTransform
                .getTranslateInstance(target.getX(), target.getY());
    }

    /**
     * Constructs a {@code BoxSizing} projecting the given source view-box
     * onto the given target bounds.  The horizontal and vertical scale are
     * independent.
     *
     * @param  viewBox  viewport position and dimension in source space
     * @param  target  final leaf bounds
     */
    public BoxSizing(Rectangle2D viewBox, Rectangle2D target) {
        this.target = (Rectangle2D) target.clone();

        AffineTransform txf = AffineTransform
                .getTranslateInstance(target.getX(), target.getY());
        txf.scale(target.getWidth() / viewBox.getWidth(),
                  target.getHeight() / viewBox.getHeight());
        txf.translate(-viewBox.getX(), -viewBox.getY());
        this.transform = txf;
    }

    public static BoxSizing of(Optional<Rectangle2D> viewBox, Rectangle2D target) {
        return viewBox.isPresent() ? new BoxSizing(viewBox.get(), target)
                                   : new BoxSizing(target);
    }

    public AffineTransform getTransform() {
        return new AffineTransform(transform);
    }

    /**
     * {@return the SVG {@code transform} attribute value}  A plain
     * translation is written as {@code translate(x,y)}, anything else as
     * {@code matrix(a,b,c,d,e,f)}.
     */
    public String toSVG() {
        if ((transform.getType() & ~AffineTransform.TYPE_TRANSLATION) == 0) {
            return "translate(" + format(transform.getTranslateX())
                    + "," + format(transform.getTranslateY()) + ")";
        }
        double[] matrix = new double[6];
        transform.getMatrix(matrix);
        StringBuilder buf = new StringBuilder("matrix(");
        for (int i = 0; i < matrix.length; i++) {
            if (i > 0) buf.append(',');
            buf.append(format(matrix[i]));
        }
        return buf.append(')').toString();
    }

} // class BoxSizing
