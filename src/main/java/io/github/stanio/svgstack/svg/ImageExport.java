/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack.svg;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Base64;
import java.util.Locale;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Replaces inline (<code>data:</code> URI) raster images with links to
 * standalone files:
 * <pre>
 * <code>&lt;image xlink:href="data:image/png;base64,iVBORw0KGgo..." /></code></pre>
 * <p>
 * becomes:</p>
 * <pre>
 * <code>&lt;image xlink:href="image001.png" /></code></pre>
 */
public final class ImageExport {

    static final Logger log = Logger.getLogger(ImageExport.class.getName());

    public static final String DEFAULT_NAME_PATTERN = "image%03d";

    private static final Pattern DATA_URI =
            Pattern.compile("^\\s*data:image/(png|jpeg);base64,(.*)$", Pattern.DOTALL);

    private ImageExport() {/* no instances */}

    /**
     * Exports the inline images found in the given subtree.
     *
     * @param   root  subtree to search for {@code <image>} elements
     * @param   dir  directory to save the image files into
     * @param   namePattern  {@code String.format()} pattern for the base file
     *          names, given the image index
     * @param   startIndex  index of the first image
     * @return  the number of images exported
     * @throws  SVGFormatException  if an image has a {@code data:} URI of a
     *          type other than PNG or JPEG
     * @throws  java.nio.file.FileAlreadyExistsException  if the target file
     *          for an image already exists
     * @throws  IOException  if an I/O error occurs
     */
    public static int exportImages(Element root, Path dir,
                                   String namePattern, int startIndex)
            throws IOException {
        return exportImages((Node) root, dir, namePattern, startIndex);
    }

    private static int exportImages(Node node, Path dir,
                                    String namePattern, int startIndex)
            throws IOException {
        int count = 0;
        if (SVGNamespaces.isSVG(node, "image")) {
            Element image = (Element) node;
            String href = image.getAttributeNS(SVGNamespaces.XLINK, "href");
            if (href.isEmpty()) {
                href = image.getAttribute("href");
            }
            if (href.startsWith("data:")) {
                Matcher m = DATA_URI.matcher(href);
                if (!m.matches()) {
                    throw new SVGFormatException("Unsupported inline image: "
                            + href.substring(0, Math.min(href.length(), 32)) + "...");
                }
                byte[] data = Base64.getMimeDecoder().decode(m.group(2));
                String fileName = String.format(Locale.ROOT, namePattern, startIndex)
                                  + "." + m.group(1);
                Files.write(dir.resolve(fileName), data, StandardOpenOption.CREATE_NEW);
                log.fine(() -> "Exported " + data.length + " bytes to " + fileName);

                if (image.hasAttributeNS(SVGNamespaces.XLINK, "href")) {
                    image.setAttributeNS(SVGNamespaces.XLINK, "xlink:href", fileName);
                } else {
                    image.setAttribute("href", fileName);
                }
                count += 1;
            }
        }

        for (Node child = node.getFirstChild();
                child != null; child = child.getNextSibling()) {
            count += exportImages(child, dir, namePattern, startIndex + count);
        }
        return count;
    }

}
