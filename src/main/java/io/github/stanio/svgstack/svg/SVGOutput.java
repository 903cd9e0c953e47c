/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack.svg;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import javax.xml.XMLConstants;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerConfigurationException;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.w3c.dom.Document;

/**
 * Writes SVG documents as UTF-8 text starting with a fixed XML
 * declaration line:
 * <pre>
 * <code>&lt;?xml version="1.0" encoding="UTF-8"?></code></pre>
 */
public final class SVGOutput {

    public static final String HEADER = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    private static final ThreadLocal<Transformer> identityTransformer = ThreadLocal
            .withInitial(SVGOutput::newTransformer);

    private SVGOutput() {/* no instances */}

    static Transformer newTransformer() {
        Transformer transformer;
        try {
            TransformerFactory tf = TransformerFactory.newInstance();
            tf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            transformer = tf.newTransformer();
        } catch (TransformerConfigurationException e) {
            throw new IllegalStateException(e);
        }
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
        return transformer;
    }

    /**
     * Writes the given document to the given stream.  The stream is flushed
     * but not closed.
     *
     * @param   svg  document to write
     * @param   out  stream to write to
     * @throws  IOException  if an I/O error occurs
     */
    public static void write(Document svg, OutputStream out) throws IOException {
        Writer text = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        text.write(HEADER);
        text.write('\n');
        try {
            Transformer transformer = identityTransformer.get();
            transformer.reset();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.transform(new DOMSource(svg), new StreamResult(text));
        } catch (TransformerException e) {
            throw ioException(e);
        }
        text.write('\n');
        text.flush();
    }

    private static IOException ioException(TransformerException e) {
        Throwable cause = e.getCause();
        if (cause instanceof IOException) {
            return (IOException) cause;
        }
        return new IOException(e);
    }

}
