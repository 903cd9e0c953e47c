/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import java.util.Objects;

import io.github.stanio.svgstack.svg.SVGSource;

/**
 * A source document taking part in a composition as a unit.
 */
public abstract class Leaf extends LayoutItem {

    private final SVGSource source;

    Leaf(SVGSource source) {
        this.source = Objects.requireNonNull(source);
    }

    public SVGSource source() {
        return source;
    }

    public Size naturalSize() {
        return new Size(source.width(), source.height());
    }

    @Override
    public Size measure(Size minSize) {
        return naturalSize();
    }

}
