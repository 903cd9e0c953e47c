/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

/**
 * Signals the placed leaves couldn't be merged into a single document.
 *
 * @see  LayoutAccumulator#finalizeDocument()
 */
public class CompositionException extends Exception {

    private static final long serialVersionUID = -2871960348315873040L;

    public CompositionException(String message) {
        super(message);
    }

    public CompositionException(String message, Throwable cause) {
        super(message, cause);
    }

}
