/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import io.github.stanio.svgscene.geom.Transform;
import io.github.stanio.svgscene.markup.MarkupElement;
import io.github.stanio.svgscene.paint.Color;
import io.github.stanio.svgscene.paint.Fill;
import io.github.stanio.svgscene.paint.Gradient;
import io.github.stanio.svgscene.paint.LinearGradient;
import io.github.stanio.svgscene.paint.RadialGradient;
import io.github.stanio.svgscene.paint.Stop;

/**
 * Builds {@code linearGradient} and {@code radialGradient} fills.
 * <p>
 * A gradient may inherit stops and geometry from another, already
 * registered gradient it references with {@code href}.  A gradient with
 * a single stop becomes that stop's color.</p>
 */
final class GradientParser {

    private final DefinitionRegistry definitions;
    private final TransformParser transforms;
    private final Diagnostics diagnostics;

    GradientParser(DefinitionRegistry definitions,
                   TransformParser transforms,
                   Diagnostics diagnostics) {
        this.definitions = definitions;
        this.transforms = transforms;
        this.diagnostics = diagnostics;
    }

    static boolean isGradient(MarkupElement element) {
        String name = element.name();
        return name.equals("linearGradient") || name.equals("radialGradient");
    }

    /**
     * @param   element  a {@code linearGradient} or {@code radialGradient}
     * @return  the gradient, a solid color, or empty if there are no
     *          stops
     */
    Optional<Fill> parse(MarkupElement element) {
        Gradient parent = parent(element);

        List<Stop> stops;
        if (element.children().isEmpty()) {
            stops = (parent == null) ? Collections.emptyList() : parent.stops();
        } else {
            stops = stops(element.children());
        }

        switch (stops.size()) {
        case 0:
            diagnostics.fine(element.name(), "No stops in {0}",
                             element.attribute("id").orElse("gradient"));
            return Optional.empty();
        case 1:
            return Optional.of(stops.get(0).color());
        default:
            // gradient
        }

        boolean userSpace = element.attribute("gradientUnits")
                .map(units -> units.strip().equals("userSpaceOnUse"))
                .orElse(false)
                || (parent != null && parent.userSpace());

        Transform transform = transforms.parse(element
                .attribute("gradientTransform").orElse(null), element.name());

        if (element.name().equals("radialGradient")) {
            RadialGradient base = (parent instanceof RadialGradient)
                                  ? (RadialGradient) parent : null;
            double cx = geometry(element, "cx", base == null ? null : base.cx(), 0.5);
            double cy = geometry(element, "cy", base == null ? null : base.cy(), 0.5);
            double fx = geometry(element, "fx", base == null ? null : base.fx(), cx);
            double fy = geometry(element, "fy", base == null ? null : base.fy(), cy);
            double r = geometry(element, "r", base == null ? null : base.r(), 0.5);
            return Optional.of(new RadialGradient(cx, cy, fx, fy, r,
                                                  userSpace, stops, transform));
        }

        LinearGradient base = (parent instanceof LinearGradient)
                              ? (LinearGradient) parent : null;
        double x1 = geometry(element, "x1", base == null ? null : base.x1(), 0);
        double y1 = geometry(element, "y1", base == null ? null : base.y1(), 0);
        double x2 = geometry(element, "x2", base == null ? null : base.x2(), 1);
        double y2 = geometry(element, "y2", base == null ? null : base.y2(), 0);
        return Optional.of(new LinearGradient(x1, y1, x2, y2,
                                              userSpace, stops, transform));
    }

    private Gradient parent(MarkupElement element) {
        Optional<String> href = ReferenceResolver.href(element);
        if (href.isEmpty())
            return null;

        Optional<Fill> fill = ReferenceResolver.id(href.get())
                                               .flatMap(definitions::fill);
        if (fill.isEmpty()) {
            diagnostics.warning(element.name(), "Unresolved gradient reference: {0}",
                                href.get());
            return null;
        }
        return (fill.get() instanceof Gradient) ? (Gradient) fill.get() : null;
    }

    private static double geometry(MarkupElement element, String name,
                                   Double inherited, double defaultValue) {
        OptionalDouble value = SVGAttributes.percentValue(element, name);
        if (value.isPresent())
            return value.getAsDouble();

        return (inherited == null) ? defaultValue : inherited;
    }

    private List<Stop> stops(List<MarkupElement> children) {
        List<Stop> stops = new ArrayList<>(children.size());
        for (MarkupElement child : children) {
            if (!child.name().equals("stop"))
                continue;

            Stop stop = stop(child);
            if (stop != null) {
                stops.add(stop);
            }
        }
        return stops;
    }

    /**
     * @return  the stop, or {@code null} if it has no valid offset
     */
    private Stop stop(MarkupElement element) {
        OptionalDouble offset = SVGAttributes.percentValue(element, "offset");
        if (offset.isEmpty()) {
            diagnostics.fine(element.name(), "Missing or invalid offset: {0}",
                             element.attribute("offset").orElse(""));
            return null;
        }

        Map<String, String> style = StyleResolver.resolve(Collections.emptyMap(), element);
        double opacity = Optional.ofNullable(style.get("stop-opacity"))
                .map(SVGAttributes::parseDouble)
                .filter(OptionalDouble::isPresent)
                .map(OptionalDouble::getAsDouble)
                .orElse(1.0);
        opacity = Math.max(0, Math.min(1, opacity));

        Color color = Color.BLACK.withOpacity(opacity);
        String stopColor = style.get("stop-color");
        if (stopColor != null) {
            color = Color.decode(stopColor, opacity).orElse(color);
        }
        return new Stop(Math.max(0, Math.min(1, offset.getAsDouble())), color);
    }

}
