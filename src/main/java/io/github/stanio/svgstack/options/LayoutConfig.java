/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack.options;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;

import io.github.stanio.svgstack.Alignment;
import io.github.stanio.svgstack.BoxLayout;
import io.github.stanio.svgstack.Direction;
import io.github.stanio.svgstack.svg.SVGFormatException;
import io.github.stanio.svgstack.svg.SVGLength;
import io.github.stanio.svgstack.svg.SVGSource;

/**
 * Layout description file:
 * <pre>
 * <code>{
 *   "direction": "horizontal",
 *   "spacing": "5px",
 *   "margin": "2mm",
 *   "items": [
 *     { "file": "a.svg", "stretch": 1, "align": "center", "xml": "&lt;text>A&lt;/text>" },
 *     { "file": "b.svg", "noLayout": true, "x": 10, "y": 20 },
 *     { "layout": { "direction": "vertical", "items": [ <var>...</var> ] }, "stretch": 2 }
 *   ]
 * }</code></pre>
 * <p>
 * Source file names are resolved against the directory of the
 * description file.  {@code direction} defaults to {@code vertical},
 * {@code align} to {@code fill}.</p>
 */
public class LayoutConfig {

    private final Gson gson;

    public LayoutConfig() {
        this.gson = new Gson();
    }

    /**
     * Loads a layout description, and the source files it refers to.
     *
     * @param   configFile  the layout description file
     * @return  the described layout
     * @throws  IOException  if an I/O error occurs reading the description,
     *          or a source file
     * @throws  JsonParseException  if the description is malformed
     */
    public BoxLayout load(Path configFile) throws IOException, JsonParseException {
        try (InputStream fin = Files.newInputStream(configFile);
                Reader text = new InputStreamReader(fin, StandardCharsets.UTF_8)) {
            Path baseDir = configFile.toAbsolutePath().getParent();
            return parse(text, baseDir);
        }
    }

    public BoxLayout parse(Reader text, Path baseDir) throws IOException, JsonParseException {
        LayoutNode root;
        try {
            root = gson.fromJson(text, LayoutNode.class);
        } catch (JsonIOException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw e;
        }
        if (root == null) {
            throw new JsonParseException("Empty layout description");
        }
        return createLayout(root, baseDir);
    }

    private static BoxLayout createLayout(LayoutNode node, Path baseDir)
            throws IOException {
        BoxLayout layout;
        try {
            layout = new BoxLayout(node.direction == null
                                   ? Direction.TOP_TO_BOTTOM
                                   : Direction.parse(node.direction));
            if (node.spacing != null) {
                layout.setSpacing(SVGLength.toPixels(node.spacing));
            }
            if (node.margin != null) {
                layout.setContentsMargins(SVGLength.toPixels(node.margin));
            }
        } catch (RuntimeException | SVGFormatException e) {
            throw new JsonParseException(e.getMessage(), e);
        }

        if (node.items == null)
            return layout;

        for (ItemNode item : node.items) {
            if (item == null || (item.file == null) == (item.layout == null)) {
                throw new JsonParseException("Specify one of \"file\" or \"layout\" per item");
            }
            double stretch = (item.stretch == null) ? 0 : item.stretch;
            if (item.layout != null) {
                BoxLayout nested = createLayout(item.layout, baseDir);
                addItem(() -> layout.addLayout(nested, stretch));
                continue;
            }

            Path file = (baseDir == null) ? Path.of(item.file)
                                          : baseDir.resolve(item.file);
            SVGSource source = SVGSource.load(file);
            if (Boolean.TRUE.equals(item.noLayout)) {
                double x = (item.x == null) ? 0 : item.x;
                double y = (item.y == null) ? 0 : item.y;
                addItem(() -> layout.addSVGNoLayout(source, x, y, item.xml));
            } else {
                addItem(() -> layout.addSVG(source, stretch,
                        (item.align == null) ? Alignment.FILL
                                             : Alignment.parse(item.align),
                        item.xml));
            }
        }
        return layout;
    }

    private static void addItem(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            throw new JsonParseException(e.getMessage(), e);
        }
    }


    static class LayoutNode {

        String direction;

        // Lengths with optional unit: 5, "5px", "2mm"
        String spacing;
        String margin;

        List<ItemNode> items;

    }


    static class ItemNode {

        String file;
        LayoutNode layout;

        Double stretch;
        String align;

        Boolean noLayout;
        Double x;
        Double y;

        String xml;

    }


}
