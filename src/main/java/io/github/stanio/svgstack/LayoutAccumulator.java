/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import static io.github.stanio.svgstack.svg.SVGLength.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import javax.xml.XMLConstants;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;

import io.github.stanio.svgstack.svg.FragmentIds;
import io.github.stanio.svgstack.svg.SVGNamespaces;
import io.github.stanio.svgstack.svg.SVGSource;
import io.github.stanio.svgstack.util.LocalDocumentBuilder;

/**
 * Collects the placed leaves of a layout, and merges them into a single
 * document:
 * <pre>
 * <code>&lt;svg width="<var>#</var>" height="<var>#</var>" ...>
 *   &lt;defs>
 *     <var>(definitions of all leaves)</var>
 *   &lt;/defs>
 *   &lt;g id="id0" transform="<var>...</var>">
 *     <var>(content of leaf #0)</var>
 *   &lt;/g>
 *   &lt;g id="id1" transform="<var>...</var>">
 *     <var>(content of leaf #1)</var>
 *   &lt;/g>
 *   <var>...</var>
 *   <var>(decorations)</var>
 * &lt;/svg></code></pre>
 * <p>
 * Leaves are numbered in registration order: flowed leaves first, then
 * the no-layout ones.  The leaf number makes the {@code id<var>N</var>:}
 * prefix of its identifiers, and determines the paint order.</p>
 * <p>
 * An accumulator is finalized once.</p>
 *
 * @see  FragmentIds
 */
public class LayoutAccumulator {

    static final Logger log = Logger.getLogger(LayoutAccumulator.class.getName());

    static final String FLOW_LEAF_BOX = "fill: none; stroke: red; stroke-width: 1;";
    static final String FIXED_LEAF_BOX = "fill: none; stroke: green; stroke-width: 1;";

    private static final LocalDocumentBuilder localBuilder = LocalDocumentBuilder.newInstance();

    private final List<PlacedLeaf> flowLeaves = new ArrayList<>();
    private final List<PlacedLeaf> fixedLeaves = new ArrayList<>();
    private final Set<Leaf> registered = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<Element> rawElements = new ArrayList<>();

    private final Document output;

    private Size size;

    private boolean finalized;

    public LayoutAccumulator() {
        output = localBuilder.newDocument();
    }

    private void checkNotFinalized() {
        if (finalized) {
            throw new IllegalStateException("Already finalized");
        }
    }

    private void register(Leaf leaf) {
        checkNotFinalized();
        if (!registered.add(leaf)) {
            throw new IllegalArgumentException("Can't accumulate " + leaf + " twice");
        }
    }

    public void addFlowed(FlowLeaf leaf, Rectangle2D bounds) {
        register(leaf);
        flowLeaves.add(new PlacedLeaf(leaf, bounds, true));
    }

    public void addFixed(FixedLeaf leaf, Rectangle2D bounds) {
        register(leaf);
        fixedLeaves.add(new PlacedLeaf(leaf, bounds, false));
    }

    /**
     * Adds an element to draw over all leaves.
     *
     * @param  element  an element owned by {@link #ownerDocument()}
     */
    public void addRawElement(Element element) {
        checkNotFinalized();
        if (element.getOwnerDocument() != output) {
            throw new IllegalArgumentException("Element not owned by the output document");
        }
        rawElements.add(element);
    }

    void addDecoration(Decoration decoration, Point2D position) {
        Element group = output.createElementNS(SVGNamespaces.SVG, "g");
        group.setAttribute("transform", "translate(" + format(position.getX())
                                        + "," + format(position.getY()) + ")");
        for (Node node : decoration.nodes()) {
            group.appendChild(output.importNode(node, true));
        }
        addRawElement(group);
    }

    void addDebugBox(Rectangle2D bounds, String style) {
        Element rect = output.createElementNS(SVGNamespaces.SVG, "rect");
        rect.setAttribute("style", style);
        rect.setAttribute("x", format(bounds.getX()));
        rect.setAttribute("y", format(bounds.getY()));
        rect.setAttribute("width", format(bounds.getWidth()));
        rect.setAttribute("height", format(bounds.getHeight()));
        addRawElement(rect);
    }

    /**
     * The document the output is assembled into.
     */
    public Document ownerDocument() {
        return output;
    }

    public Size size() {
        return size;
    }

    public void setSize(Size size) {
        checkNotFinalized();
        this.size = size;
    }

    /**
     * {@return the number of accumulated leaves}
     */
    public int leafCount() {
        return flowLeaves.size() + fixedLeaves.size();
    }

    /**
     * Merges the accumulated leaves into a single document of the
     * accumulated size.  Source documents are not modified.
     *
     * @return  the merged document
     * @throws  NamespaceConflictException  if sources bind the same prefix to
     *          different namespaces
     * @throws  RescaleNotSupportedException  if a flowed leaf without a
     *          {@code viewBox} has been resized
     * @throws  IllegalStateException  if the size has not been set, or
     *          already finalized
     */
    public Document finalizeDocument() throws CompositionException {
        checkNotFinalized();
        if (size == null) {
            throw new IllegalStateException("Size not set");
        }

        List<PlacedLeaf> workList = new ArrayList<>(flowLeaves);
        workList.addAll(fixedLeaves);

        Map<String, String> namespaces = collectNamespaces(workList);

        Element root = output.createElementNS(SVGNamespaces.SVG, "svg");
        namespaces.forEach((prefix, uri) -> {
            String qname = prefix.isEmpty() ? XMLConstants.XMLNS_ATTRIBUTE
                                            : XMLConstants.XMLNS_ATTRIBUTE + ":" + prefix;
            root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, qname, uri);
        });
        root.setAttribute("version", "1.1");
        root.setAttribute("width", format(size.width()));
        root.setAttribute("height", format(size.height()));

        Element defs = output.createElementNS(SVGNamespaces.SVG, "defs");
        appendLine(root, defs);

        int leafNumber = 0;
        for (PlacedLeaf item : workList) {
            appendLine(root, mergeLeaf(item, leafNumber++, defs));
        }
        for (Element element : rawElements) {
            appendLine(root, element);
        }
        root.appendChild(output.createTextNode("\n"));

        output.appendChild(root);
        finalized = true;
        return output;
    }

    private void appendLine(Element parent, Node child) {
        parent.appendChild(output.createTextNode("\n"));
        parent.appendChild(child);
    }

    private static Map<String, String> collectNamespaces(List<PlacedLeaf> leaves)
            throws NamespaceConflictException {
        Map<String, String> namespaces = new LinkedHashMap<>();
        namespaces.put(XMLConstants.DEFAULT_NS_PREFIX, SVGNamespaces.SVG);
        namespaces.put("xlink", SVGNamespaces.XLINK);
        namespaces.put("sodipodi", SVGNamespaces.SODIPODI);

        for (PlacedLeaf item : leaves) {
            SVGSource source = item.leaf.source();
            for (Map.Entry<String, String> entry :
                    SVGNamespaces.declaredPrefixes(source.root()).entrySet()) {
                String prefix = entry.getKey();
                String uri = entry.getValue();
                if (prefix.equals("svg") && uri.equals(SVGNamespaces.SVG))
                    continue; // the default namespace

                String existing = namespaces.putIfAbsent(prefix, uri);
                if (existing == null) {
                    log.fine(() -> "Adding " + uri + " as " + prefix);
                } else if (!existing.equals(uri)) {
                    throw new NamespaceConflictException(source.name(), prefix, uri, existing);
                }
            }
        }
        return namespaces;
    }

    private Element mergeLeaf(PlacedLeaf item, int leafNumber, Element defs)
            throws RescaleNotSupportedException {
        SVGSource source = item.leaf.source();
        String idPrefix = "id" + leafNumber + ":";

        Element group = output.createElementNS(SVGNamespaces.SVG, "g");
        for (Node child = source.root().getFirstChild();
                child != null; child = child.getNextSibling()) {
            if (SVGNamespaces.isSVG(child, "defs")) {
                hoistDefinitions(child, idPrefix, defs);
            } else if (!isEditorData(child)) {
                Node copy = output.importNode(child, true);
                FragmentIds.prefix(copy, idPrefix);
                group.appendChild(copy);
            }
        }
        group.setAttribute("id", "id" + leafNumber);

        Rectangle2D bounds = item.bounds;
        Size natural = item.leaf.naturalSize();
        if (item.flowed && source.viewBox().isEmpty()
                && !(sameLength(natural.width(), bounds.getWidth())
                        && sameLength(natural.height(), bounds.getHeight()))) {
            log.severe(() -> source.name() + " (" + idPrefix + ") natural size "
                             + natural + " != final size " + Size.of(bounds));
            throw new RescaleNotSupportedException(source.name(), natural, Size.of(bounds));
        }

        BoxSizing sizing = BoxSizing.of(source.viewBox(), bounds);
        group.setAttribute("transform", sizing.toSVG());
        log.fine(() -> source.name() + ": " + sizing.toSVG());
        return group;
    }

    private void hoistDefinitions(Node sourceDefs, String idPrefix, Element defs) {
        for (Node child = sourceDefs.getFirstChild();
                child != null; child = child.getNextSibling()) {
            if (child.getNodeType() != Node.ELEMENT_NODE)
                continue;

            Node copy = output.importNode(child, true);
            FragmentIds.prefix(copy, idPrefix);
            defs.appendChild(copy);
        }
    }

    private static boolean isEditorData(Node node) {
        return SVGNamespaces.isSVG(node, "metadata")
                || SVGNamespaces.SODIPODI.equals(node.getNamespaceURI())
                        && "namedview".equals(node.getLocalName());
    }

    private static boolean sameLength(double a, double b) {
        return Math.abs(a - b) <= 1e-9 * Math.max(1, Math.abs(a));
    }


    private static final class PlacedLeaf {
        final Leaf leaf;
        final Rectangle2D bounds;
        final boolean flowed;

        PlacedLeaf(Leaf leaf, Rectangle2D bounds, boolean flowed) {
            this.leaf = leaf;
            this.bounds = (Rectangle2D) bounds.clone();
            this.flowed = flowed;
        }
    }


} // class LayoutAccumulator
