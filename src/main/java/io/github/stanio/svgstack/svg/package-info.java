/**
 * Provides SVG processing classes not specific to the <i>svgstack</i> layout.
 * Notable classes include:
 * <ul>
 * <li>{@link io.github.stanio.svgstack.svg.SVGSource}
 * <li>{@link io.github.stanio.svgstack.svg.FragmentIds}
 * </ul>
 */
package io.github.stanio.svgstack.svg;
