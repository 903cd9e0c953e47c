/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.w3c.dom.Document;

import io.github.stanio.svgstack.svg.SVGOutput;

/**
 * A composite SVG document built from a {@link BoxLayout} of source
 * documents.
 * <pre>
 * BoxLayout layout = BoxLayout.horizontal();
 * layout.setSpacing(10);
 * layout.addSVG(SVGSource.load(Path.of("a.svg")), 0, Alignment.CENTER);
 * layout.addSVG(SVGSource.load(Path.of("b.svg")), 0, Alignment.CENTER);
 *
 * SVGStack doc = new SVGStack();
 * doc.setLayout(layout);
 * doc.save(Path.of("ab.svg"));</pre>
 */
public class SVGStack {

    private BoxLayout layout;

    public SVGStack() {
        // empty
    }

    public SVGStack(BoxLayout layout) {
        this.layout = layout;
    }

    public BoxLayout layout() {
        return layout;
    }

    public void setLayout(BoxLayout layout) {
        this.layout = layout;
    }

    /**
     * Lays out and merges the sources into a new document.  Each call
     * produces a fresh document.
     *
     * @param   debugBoxes  whether to draw outlines around layout boxes and
     *          leaves
     * @return  the composed document
     * @throws  CompositionException  if the sources can't be merged
     * @throws  IllegalStateException  if no layout has been set
     */
    public Document compose(boolean debugBoxes) throws CompositionException {
        if (layout == null) {
            throw new IllegalStateException("No layout, cannot save");
        }
        LayoutAccumulator accumulator = new LayoutAccumulator();
        layout.render(accumulator, debugBoxes);
        return accumulator.finalizeDocument();
    }

    public void save(OutputStream out) throws IOException, CompositionException {
        save(out, false);
    }

    /**
     * Writes the composed document to the given stream.  Nothing is written
     * if the composition fails.
     */
    public void save(OutputStream out, boolean debugBoxes)
            throws IOException, CompositionException {
        SVGOutput.write(compose(debugBoxes), out);
    }

    public void save(Path file) throws IOException, CompositionException {
        save(file, false);
    }

    /**
     * Writes the composed document to the given file.  The file is not
     * created, or overwritten, if the composition fails.
     */
    public void save(Path file, boolean debugBoxes)
            throws IOException, CompositionException {
        Document svg = compose(debugBoxes);
        try (OutputStream out = Files.newOutputStream(file)) {
            SVGOutput.write(svg, out);
        }
    }

}
