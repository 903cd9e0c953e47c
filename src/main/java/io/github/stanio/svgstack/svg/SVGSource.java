/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack.svg;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;

import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgstack.util.LocalDocumentBuilder;

/**
 * A parsed SVG source document together with its natural size:
 * <pre>
 * <code>&lt;svg width="<var>#</var><var>unit</var>" height="<var>#</var><var>unit</var>" viewBox="<var>#</var> <var>#</var> <var>#</var> <var>#</var>" ...></code></pre>
 * <p>
 * Without {@code width} and {@code height} (as written by R's <i>svglite</i>,
 * for example) the natural size is taken from the {@code viewBox}.</p>
 * <p>
 * The source document is treated as read-only by the composition.</p>
 */
public class SVGSource {

    static final Logger log = Logger.getLogger(SVGSource.class.getName());

    private static final LocalDocumentBuilder localBuilder = LocalDocumentBuilder.newInstance();

    private final String name;
    private final Document document;
    private final double width;
    private final double height;
    private final Optional<Rectangle2D> viewBox;

    private SVGSource(String name, Document document,
                      double width, double height,
                      Optional<Rectangle2D> viewBox) {
        this.name = name;
        this.document = document;
        this.width = width;
        this.height = height;
        this.viewBox = viewBox;
    }

    public static SVGSource load(Path file) throws IOException {
        return read(new InputSource(file.toUri().toString()), file.toString());
    }

    public static SVGSource fromString(String xml, String name) throws IOException {
        InputSource input = new InputSource(new StringReader(xml));
        input.setSystemId(name);
        return read(input, name);
    }

    public static SVGSource read(InputSource input, String name) throws IOException {
        Document document;
        try {
            document = localBuilder.get().parse(input);
        } catch (SAXException e) {
            throw new SVGFormatException(name + ": " + e.getMessage(), e);
        }
        return of(document, name);
    }

    public static SVGSource of(Document document, String name) throws SVGFormatException {
        Element root = document.getDocumentElement();
        if (root == null || !SVGNamespaces.isSVG(root, "svg")) {
            throw SVGFormatException.of(name, "expected root element <svg:svg>, found "
                    + (root == null ? "none" : "{" + root.getNamespaceURI() + "}"
                                               + root.getLocalName()));
        }

        Optional<Rectangle2D> viewBox = parseViewBox(name, root);
        double width;
        double height;
        if (root.hasAttribute("width") && root.hasAttribute("height")) {
            width = toPixels(name, root.getAttribute("width"));
            height = toPixels(name, root.getAttribute("height"));
            if (!(width >= 0 && height >= 0)
                    || Double.isInfinite(width) || Double.isInfinite(height)) {
                throw SVGFormatException.of(name, "width and height should be"
                        + " finite non-negative lengths: width=\"" + root.getAttribute("width")
                        + "\" height=\"" + root.getAttribute("height") + '"');
            }
        } else if (viewBox.isPresent()) {
            width = viewBox.get().getWidth();
            height = viewBox.get().getHeight();
        } else {
            throw SVGFormatException.of(name,
                    "no width/height attributes, nor viewBox to get the size from");
        }
        log.fine(() -> String.format(Locale.ROOT, "Size of %s is %.2f x %.2f px", name, width, height));
        return new SVGSource(name, document, width, height, viewBox);
    }

    private static double toPixels(String name, String value) throws SVGFormatException {
        try {
            return SVGLength.toPixels(value);
        } catch (SVGFormatException e) {
            throw new SVGFormatException(name + ": " + e.getMessage(), e);
        }
    }

    static Optional<Rectangle2D> parseViewBox(String name, Element root)
            throws SVGFormatException {
        if (!root.hasAttribute("viewBox"))
            return Optional.empty();

        String value = root.getAttribute("viewBox");
        String[] tokens = value.strip().split("\\s*,\\s*|\\s+");
        if (tokens.length != 4) {
            throw SVGFormatException.of(name, "viewBox should have 4 numbers: \""
                                              + value + '"');
        }

        double[] box = new double[4];
        try {
            for (int i = 0; i < 4; i++) {
                box[i] = Double.parseDouble(tokens[i]);
            }
        } catch (NumberFormatException e) {
            throw new SVGFormatException(name + ": malformed viewBox \""
                                         + value + '"', e);
        }
        if (!(box[2] > 0 && box[3] > 0)
                || Double.isInfinite(box[2]) || Double.isInfinite(box[3])) {
            throw SVGFormatException.of(name, "viewBox width and height should be"
                                              + " finite positive numbers: \"" + value + '"');
        }
        return Optional.of(new Rectangle2D.Double(box[0], box[1], box[2], box[3]));
    }

    public String name() {
        return name;
    }

    public Document document() {
        return document;
    }

    public Element root() {
        return document.getDocumentElement();
    }

    /**
     * {@return the natural width in pixels}
     */
    public double width() {
        return width;
    }

    /**
     * {@return the natural height in pixels}
     */
    public double height() {
        return height;
    }

    /**
     * {@code <svg viewBox="# # # #">}
     */
    public Optional<Rectangle2D> viewBox() {
        return viewBox.map(box -> (Rectangle2D) box.clone());
    }

    @Override
    public String toString() {
        return "SVGSource(" + name + ")";
    }

}
