/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

/**
 * Two sources bind the same namespace prefix to different namespaces.
 */
public class NamespaceConflictException extends CompositionException {

    private static final long serialVersionUID = 6045315902274651262L;

    private final String prefix;

    public NamespaceConflictException(String source, String prefix,
                                      String namespace, String existing) {
        super(source + ": prefix \"" + prefix + "\" bound to " + namespace
                + ", but already bound to " + existing);
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

}
