/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack.svg;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

/**
 * Prefixes element identifiers and the local references to them, so
 * content of multiple documents could be merged into one without clashes:
 * <pre>
 * <code>&lt;linearGradient id="<strong>id1:</strong>grad" />
 * &lt;use xlink:href="#<strong>id1:</strong>shape" />
 * &lt;path style="fill: url(#<strong>id1:</strong>grad)" /></code></pre>
 * <p>
 * Only elements in the SVG namespace are updated, but the whole subtree is
 * traversed.  References are recognized as:</p>
 * <ul>
 * <li>{@code #fragment} values of {@code xlink:*} and (SVG 2) {@code href}
 *     attributes;</li>
 * <li>{@code url(#fragment)} anywhere in any attribute value.</li>
 * </ul>
 * <p>
 * Other values starting with {@code #} (colors) are left as they are.</p>
 *
 * @see  <a href="https://www.w3.org/TR/SVGTiny12/linking.html#IRIReference"
 *              >IRI references</a> <i>(SVG Tiny 1.2)</i>
 */
public final class FragmentIds {

    private static final Pattern FUNC_IRI = Pattern.compile("(url\\(\\s*['\"]?#)");

    private FragmentIds() {/* no instances */}

    /**
     * Prefixes identifiers and references in the given subtree.  A single
     * pass suffices as a prefix never introduces new reference patterns.
     *
     * @param  node  root of the subtree to update
     * @param  prefix  prefix to prepend
     */
    public static void prefix(Node node, String prefix) {
        if (node.getNodeType() == Node.ELEMENT_NODE && SVGNamespaces.isSVG(node)) {
            prefixAttributes((Element) node, prefix);
        }

        for (Node child = node.getFirstChild();
                child != null; child = child.getNextSibling()) {
            prefix(child, prefix);
        }
    }

    private static void prefixAttributes(Element element, String prefix) {
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0, len = attributes.getLength(); i < len; i++) {
            Attr attr = (Attr) attributes.item(i);
            String value = attr.getValue();
            String newValue;
            if (isIdentifier(attr)) {
                newValue = prefix + value;
            } else if (isLink(attr) && value.startsWith("#")) {
                newValue = "#" + prefix + value.substring(1);
            } else {
                newValue = prefixFuncIRI(value, prefix);
            }
            if (!newValue.equals(value)) {
                attr.setValue(newValue);
            }
        }
    }

    private static boolean isIdentifier(Attr attr) {
        return attr.getNamespaceURI() == null && "id".equals(attr.getLocalName());
    }

    private static boolean isLink(Attr attr) {
        String namespace = attr.getNamespaceURI();
        return SVGNamespaces.XLINK.equals(namespace)
                || namespace == null && "href".equals(attr.getLocalName());
    }

    /**
     * {@code fill="url(#grad)"} → {@code fill="url(#<var>prefix</var>grad)"}
     */
    static String prefixFuncIRI(String value, String prefix) {
        if (value.indexOf("url(") < 0)
            return value;

        return FUNC_IRI.matcher(value)
                .replaceAll(m -> Matcher.quoteReplacement(m.group(1) + prefix));
    }

}
