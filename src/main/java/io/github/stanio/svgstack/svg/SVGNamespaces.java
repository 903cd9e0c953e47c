/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack.svg;

import java.util.LinkedHashMap;
import java.util.Map;

import javax.xml.XMLConstants;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

public final class SVGNamespaces {

    public static final String SVG = "http://www.w3.org/2000/svg";

    public static final String XLINK = "http://www.w3.org/1999/xlink";

    public static final String SODIPODI = "http://sodipodi.sourceforge.net/DTD/sodipodi-0.dtd";

    private SVGNamespaces() {/* no instances */}

    public static boolean isSVG(Node node) {
        return SVG.equals(node.getNamespaceURI());
    }

    public static boolean isSVG(Node node, String localName) {
        return isSVG(node) && localName.equals(node.getLocalName());
    }

    /**
     * {@return the namespace prefixes declared on the given element}  The
     * default namespace declaration, if any, is keyed by the empty string.
     */
    public static Map<String, String> declaredPrefixes(Element element) {
        Map<String, String> prefixes = new LinkedHashMap<>();
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0, len = attributes.getLength(); i < len; i++) {
            Attr attr = (Attr) attributes.item(i);
            if (!XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI()))
                continue;

            String prefix = XMLConstants.XMLNS_ATTRIBUTE.equals(attr.getLocalName())
                            ? XMLConstants.DEFAULT_NS_PREFIX
                            : attr.getLocalName();
            prefixes.put(prefix, attr.getValue());
        }
        return prefixes;
    }

}
