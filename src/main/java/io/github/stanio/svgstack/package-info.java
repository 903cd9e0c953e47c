/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */

/**
 * Provides the main <i>svgstack</i> classes.
 * <ul>
 * <li>{@link io.github.stanio.svgstack.BoxLayout}
 * <li>{@link io.github.stanio.svgstack.SVGStack}
 * <li>{@link io.github.stanio.svgstack.SVGStackTool}
 * </ul>
 * <p><i>Svgstack</i> is a tool for composing multiple SVG documents into
 * one, arranging them in nested rows and columns.</p>
 */
package io.github.stanio.svgstack;
