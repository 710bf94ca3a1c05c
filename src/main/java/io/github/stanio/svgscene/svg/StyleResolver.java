/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import io.github.stanio.svgscene.markup.MarkupElement;
import io.github.stanio.svgscene.paint.Color;
import io.github.stanio.svgscene.paint.Fill;
import io.github.stanio.svgscene.paint.Font;
import io.github.stanio.svgscene.paint.LineCap;
import io.github.stanio.svgscene.paint.LineJoin;
import io.github.stanio.svgscene.paint.Stroke;

/**
 * Cascades presentation properties from parent to child elements, and
 * interprets the resolved values.
 * <p>
 * An element's {@code style} attribute, when present, overrides the
 * inherited properties and its presentation attributes are then ignored.
 * Otherwise the presentation attributes override.</p>
 */
final class StyleResolver {

    static final List<String> PRESENTATION_ATTRIBUTES = List.of(
            "stroke", "stroke-width", "stroke-opacity", "stroke-dasharray",
            "stroke-linecap", "stroke-linejoin",
            "fill", "fill-opacity",
            "stop-color", "stop-opacity",
            "font-family", "font-size",
            "opacity");

    private final DefinitionRegistry definitions;
    private final SceneDefaults defaults;
    private final Diagnostics diagnostics;

    StyleResolver(DefinitionRegistry definitions,
                  SceneDefaults defaults,
                  Diagnostics diagnostics) {
        this.definitions = definitions;
        this.defaults = defaults;
        this.diagnostics = diagnostics;
    }

    /**
     * {@return the style of {@code element} given its parent's style}
     * The result is unmodifiable and preserves the insertion order.
     */
    static Map<String, String> resolve(Map<String, String> parentStyle,
                                       MarkupElement element) {
        Map<String, String> style = new LinkedHashMap<>(parentStyle);
        Optional<String> inline = element.attribute("style");
        if (inline.isPresent()) {
            String declarations = inline.get().replace(" ", "");
            for (String item : declarations.split(";")) {
                String[] property = item.split(":", -1);
                if (property.length == 2) {
                    style.put(property[0], property[1]);
                }
            }
        } else {
            for (String name : PRESENTATION_ATTRIBUTES) {
                element.attribute(name)
                       .ifPresent(value -> style.put(name, value));
            }
        }
        return Collections.unmodifiableMap(style);
    }

    /**
     * @return  the fill, or {@code null} for {@code fill: none} or an
     *          unresolved reference
     */
    Fill fill(Map<String, String> style, String element) {
        String value = style.get("fill");
        if (value == null)
            return defaults.fill();

        return paint(value, opacity(style, "fill-opacity"), element);
    }

    /**
     * @return  the fill, or the default one if the style specifies none
     */
    Fill textFill(Map<String, String> style, String element) {
        Fill fill = fill(style, element);
        return (fill == null) ? defaults.fill() : fill;
    }

    /**
     * @return  the stroke, or {@code null} if none
     */
    Stroke stroke(Map<String, String> style, String element) {
        String value = style.get("stroke");
        if (value == null)
            return null;

        Fill fill = paint(value, opacity(style, "stroke-opacity"), element);
        if (fill == null)
            return null;

        return new Stroke(fill, strokeWidth(style),
                          lineCap(style.get("stroke-linecap")),
                          lineJoin(style.get("stroke-linejoin")),
                          dashes(style.get("stroke-dasharray")));
    }

    private Fill paint(String value, double opacity, String element) {
        String token = value.strip();
        if (token.equals("none"))
            return null;

        if (token.startsWith("url")) {
            Optional<String> id = ReferenceResolver.id(token);
            Optional<Fill> fill = id.flatMap(definitions::fill);
            if (fill.isEmpty()) {
                diagnostics.warning(element, "Unresolved paint reference: {0}", token);
            }
            return fill.orElse(null);
        }

        Optional<Color> color = Color.decode(token, opacity);
        if (color.isEmpty()) {
            diagnostics.fine(element, "Invalid color: {0}", token);
            return Color.BLACK.withOpacity(opacity);
        }
        return color.get();
    }

    double opacity(Map<String, String> style) {
        return opacity(style, "opacity");
    }

    private static double opacity(Map<String, String> style, String property) {
        String value = style.get(property);
        if (value == null)
            return 1;

        double opacity = SVGAttributes.parseDouble(value).orElse(1);
        return Math.max(0, Math.min(1, opacity));
    }

    private double strokeWidth(Map<String, String> style) {
        String value = style.get("stroke-width");
        if (value == null)
            return defaults.strokeWidth();

        return Math.max(0, SVGAttributes.parseLength(value)
                                        .orElse(defaults.strokeWidth()));
    }

    static LineCap lineCap(String value) {
        return "butt".equals(value) ? LineCap.BUTT : LineCap.SQUARE;
    }

    static LineJoin lineJoin(String value) {
        return "bevel".equals(value) ? LineJoin.BEVEL : LineJoin.MITER;
    }

    static double[] dashes(String value) {
        if (value == null)
            return new double[0];

        return Arrays.stream(value.split("[ ,]"))
                .filter(item -> !item.isEmpty())
                .map(SVGAttributes::parseDouble)
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .filter(length -> length >= 0)
                .toArray();
    }

    Font font(Map<String, String> style) {
        return new Font(fontName(style), fontSize(style));
    }

    String fontName(Map<String, String> style) {
        String name = style.get("font-family");
        return (name == null || name.isBlank()) ? defaults.fontName() : name.strip();
    }

    double fontSize(Map<String, String> style) {
        String value = style.get("font-size");
        if (value == null)
            return defaults.fontSize();

        double size = SVGAttributes.parseDouble(value).orElse(defaults.fontSize());
        return (size > 0) ? size : defaults.fontSize();
    }

}
