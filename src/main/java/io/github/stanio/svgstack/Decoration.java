/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import org.w3c.dom.Document;
import org.w3c.dom.Node;

import io.github.stanio.svgstack.svg.SVGNamespaces;
import io.github.stanio.svgstack.util.LocalDocumentBuilder;

/**
 * Raw SVG markup drawn over a layout item, in the item's coordinates:
 * <pre>
 * <code>&lt;text x="10" y="20">(a)&lt;/text></code></pre>
 * <p>
 * Unprefixed elements are in the SVG namespace; the {@code xlink} prefix
 * is predeclared.</p>
 */
public final class Decoration {

    private static final LocalDocumentBuilder localBuilder = LocalDocumentBuilder.newInstance();

    private final String markup;
    private final List<Node> nodes;

    private Decoration(String markup, List<Node> nodes) {
        this.markup = markup;
        this.nodes = nodes;
    }

    /**
     * Parses the given markup.
     *
     * @param   markup  one or more SVG elements
     * @return  the parsed decoration
     * @throws  IllegalArgumentException  if the markup is not well-formed
     */
    public static Decoration parse(String markup) {
        String wrapped = "<svg xmlns=\"" + SVGNamespaces.SVG
                + "\" xmlns:xlink=\"" + SVGNamespaces.XLINK + "\">"
                + markup + "</svg>";
        Document document;
        try {
            document = localBuilder.get()
                    .parse(new InputSource(new StringReader(wrapped)));
        } catch (SAXException | IOException e) {
            throw new IllegalArgumentException("Malformed decoration markup: "
                                               + e.getMessage(), e);
        }

        List<Node> nodes = new ArrayList<>();
        for (Node child = document.getDocumentElement().getFirstChild();
                child != null; child = child.getNextSibling()) {
            nodes.add(child);
        }
        return new Decoration(markup, Collections.unmodifiableList(nodes));
    }

    List<Node> nodes() {
        return nodes;
    }

    public String markup() {
        return markup;
    }

    @Override
    public String toString() {
        return "Decoration(" + markup + ")";
    }

}
