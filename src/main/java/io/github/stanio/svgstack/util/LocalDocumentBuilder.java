/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack.util;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;

/**
 * Namespace-aware {@code DocumentBuilder} instance per thread.  The
 * builder is configured for secure processing, and doesn't load external
 * DTDs.
 */
public class LocalDocumentBuilder {

    private static final String LOAD_EXTERNAL_DTD =
            "http://apache.org/xml/features/nonvalidating/load-external-dtd";

    private final ThreadLocal<DocumentBuilder> localInstance;

    protected LocalDocumentBuilder() {
        this.localInstance = ThreadLocal.withInitial(LocalDocumentBuilder::newDocumentBuilder);
    }

    public static LocalDocumentBuilder newInstance() {
        return new LocalDocumentBuilder();
    }

    /**
     * {@return this thread's builder}  It is {@linkplain DocumentBuilder#reset()
     * reset} before returning it.
     */
    public DocumentBuilder get() {
        DocumentBuilder builder = localInstance.get();
        builder.reset();
        return builder;
    }

    public Document newDocument() {
        return get().newDocument();
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(true);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setFeature(LOAD_EXTERNAL_DTD, false);
            dbf.setExpandEntityReferences(false);
            return dbf.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException(e);
        }
    }

}
