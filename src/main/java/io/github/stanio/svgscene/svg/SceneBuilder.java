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

import io.github.stanio.svgscene.geom.Circle;
import io.github.stanio.svgscene.geom.Ellipse;
import io.github.stanio.svgscene.geom.Line;
import io.github.stanio.svgscene.geom.Locus;
import io.github.stanio.svgscene.geom.Polygon;
import io.github.stanio.svgscene.geom.Polyline;
import io.github.stanio.svgscene.geom.Rect;
import io.github.stanio.svgscene.geom.RoundRect;
import io.github.stanio.svgscene.geom.Transform;
import io.github.stanio.svgscene.markup.MarkupElement;
import io.github.stanio.svgscene.scene.Align;
import io.github.stanio.svgscene.scene.AspectRatio;
import io.github.stanio.svgscene.scene.Group;
import io.github.stanio.svgscene.scene.Image;
import io.github.stanio.svgscene.scene.SceneNode;
import io.github.stanio.svgscene.scene.Shape;

/**
 * Compiles one markup tree into a scene graph.  Not reusable: every
 * document gets a fresh builder with its own definitions.
 */
final class SceneBuilder {

    private static final double FULL_TURN = 2 * Math.PI;

    private final DefinitionRegistry definitions;
    private final StyleResolver styles;
    private final TransformParser transforms;
    private final PathParser paths;
    private final ReferenceResolver references;
    private final GradientParser gradients;
    private final TextFlow texts;
    private final Diagnostics diagnostics;

    SceneBuilder(SceneDefaults defaults, TextMeasure measure, Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
        this.definitions = new DefinitionRegistry();
        this.styles = new StyleResolver(definitions, defaults, diagnostics);
        this.transforms = new TransformParser(diagnostics);
        this.paths = new PathParser(diagnostics);
        this.references = new ReferenceResolver(definitions, styles, transforms,
                                                diagnostics, defaults.maxReferenceDepth());
        this.gradients = new GradientParser(definitions, transforms, diagnostics);
        this.texts = new TextFlow(styles, measure, diagnostics);
    }

    Group build(MarkupElement root, Transform initialPosition) {
        List<SceneNode> nodes = new ArrayList<>();
        collect(root, Collections.emptyMap(), nodes);
        return new Group(nodes, initialPosition, 1.0, Collections.emptyList());
    }

    /**
     * Compiles the element into {@code target}.  Nested {@code svg}
     * elements don't create a level of their own: their children are
     * collected in place.
     */
    private void collect(MarkupElement element,
                         Map<String, String> parentStyle,
                         List<SceneNode> target) {
        if (element.name().equals("svg")) {
            Map<String, String> style = StyleResolver.resolve(parentStyle, element);
            for (MarkupElement child : element.children()) {
                collect(child, style, target);
            }
        } else {
            compile(element, parentStyle).ifPresent(target::add);
        }
    }

    Optional<SceneNode> compile(MarkupElement element,
                                Map<String, String> parentStyle) {
        switch (element.name()) {
        case "g":
            return Optional.of(group(element, parentStyle));

        case "svg":
            List<SceneNode> contents = new ArrayList<>();
            collect(element, parentStyle, contents);
            return Optional.of(new Group(contents, Transform.IDENTITY, 1.0,
                                         SVGAttributes.tags(element)));

        case "defs":
            define(element);
            return Optional.empty();

        default:
            return leaf(element, parentStyle);
        }
    }

    private Group group(MarkupElement element, Map<String, String> parentStyle) {
        Map<String, String> style = StyleResolver.resolve(parentStyle, element);
        List<SceneNode> contents = new ArrayList<>();
        for (MarkupElement child : element.children()) {
            collect(child, style, contents);
        }
        return new Group(contents, position(element), 1.0,
                         SVGAttributes.tags(element));
    }

    private void define(MarkupElement defs) {
        for (MarkupElement child : defs.children()) {
            Optional<String> id = child.attribute("id");
            if (id.isEmpty())
                continue;

            if (GradientParser.isGradient(child)) {
                gradients.parse(child)
                         .ifPresent(fill -> definitions.putFill(id.get(), fill));
            } else if (child.name().equals("mask")) {
                mask(child).ifPresent(mask -> definitions.putMask(id.get(), mask));
            } else {
                references.resetDepthMark();
                Optional<SceneNode> node = compile(child, Collections.emptyMap());
                if (node.isPresent()) {
                    definitions.putNode(id.get(), node.get(), references.depthMark());
                }
            }
        }
    }

    /**
     * The last child that compiles provides the mask outline.
     */
    private Optional<Shape> mask(MarkupElement element) {
        SceneNode content = null;
        for (MarkupElement child : element.children()) {
            Optional<SceneNode> node = compile(child, Collections.emptyMap());
            if (node.isPresent()) {
                content = node.get();
            }
        }
        if (!(content instanceof Shape)) {
            diagnostics.warning(element.name(), "Mask content is not a shape: {0}",
                                element.attribute("id").orElse(""));
            return Optional.empty();
        }

        Locus form = ((Shape) content).form();
        if (form instanceof Circle) {
            form = ((Circle) form).arc(0, FULL_TURN);
        }
        Map<String, String> style = StyleResolver.resolve(Collections.emptyMap(), element);
        return Optional.of(new Shape(form, styles.fill(style, element.name()), null,
                Transform.IDENTITY, 1.0, SVGAttributes.tags(element)));
    }

    private Optional<SceneNode> leaf(MarkupElement element,
                                     Map<String, String> parentStyle) {
        String name = element.name();
        Map<String, String> style = StyleResolver.resolve(parentStyle, element);
        Transform place = position(element);
        Optional<? extends Locus> form;
        switch (name) {
        case "path":
            form = element.attribute("d").map(d -> paths.parse(d, name));
            break;

        case "line":
            form = Optional.of(line(element));
            break;

        case "rect":
            form = rect(element);
            break;

        case "circle":
            form = circle(element);
            break;

        case "ellipse":
            form = ellipse(element);
            break;

        case "polygon":
            form = element.attribute("points")
                          .map(points -> new Polygon(SVGAttributes.points(points)));
            break;

        case "polyline":
            form = element.attribute("points")
                          .map(points -> new Polyline(SVGAttributes.points(points)));
            break;

        case "image":
            return image(element, style, place);

        case "text":
            return texts.layout(element, style, place);

        case "use":
            return references.instantiate(element, style);

        case "mask":
        case "linearGradient":
        case "radialGradient":
        case "stop":
            return Optional.empty();

        default:
            diagnostics.warning(name, "Unsupported element skipped");
            return Optional.empty();
        }

        if (form.isEmpty()) {
            diagnostics.fine(name, "Missing or invalid geometry");
            return Optional.empty();
        }

        Shape shape = new Shape(form.get(),
                                styles.fill(style, name),
                                styles.stroke(style, name),
                                place,
                                styles.opacity(style),
                                SVGAttributes.tags(element));
        element.attribute("mask")
               .ifPresent(mask -> references.applyMask(shape, mask, name));
        return Optional.of(shape);
    }

    private Transform position(MarkupElement element) {
        return transforms.parse(element.attribute("transform").orElse(null),
                                element.name());
    }

    private static Line line(MarkupElement element) {
        return new Line(SVGAttributes.doubleValue(element, "x1", 0),
                        SVGAttributes.doubleValue(element, "y1", 0),
                        SVGAttributes.doubleValue(element, "x2", 0),
                        SVGAttributes.doubleValue(element, "y2", 0));
    }

    private static Optional<Locus> rect(MarkupElement element) {
        OptionalDouble width = SVGAttributes.doubleValue(element, "width");
        OptionalDouble height = SVGAttributes.doubleValue(element, "height");
        if (width.isEmpty() || height.isEmpty()
                || !(width.getAsDouble() > 0 && height.getAsDouble() > 0))
            return Optional.empty();

        Rect rect = new Rect(SVGAttributes.doubleValue(element, "x", 0),
                             SVGAttributes.doubleValue(element, "y", 0),
                             width.getAsDouble(), height.getAsDouble());

        OptionalDouble rx = SVGAttributes.doubleValue(element, "rx");
        OptionalDouble ry = SVGAttributes.doubleValue(element, "ry");
        if (rx.isPresent() && ry.isPresent()) {
            return Optional.of(new RoundRect(rect, rx.getAsDouble(), ry.getAsDouble()));
        }
        OptionalDouble r = rx.isPresent() ? rx : ry;
        if (r.isPresent() && r.getAsDouble() >= 0) {
            return Optional.of(new RoundRect(rect, r.getAsDouble(), r.getAsDouble()));
        }
        return Optional.of(rect);
    }

    private static Optional<Locus> circle(MarkupElement element) {
        OptionalDouble r = SVGAttributes.doubleValue(element, "r");
        if (r.isEmpty() || !(r.getAsDouble() > 0))
            return Optional.empty();

        return Optional.of(new Circle(SVGAttributes.doubleValue(element, "cx", 0),
                                      SVGAttributes.doubleValue(element, "cy", 0),
                                      r.getAsDouble()));
    }

    private static Optional<Locus> ellipse(MarkupElement element) {
        OptionalDouble rx = SVGAttributes.doubleValue(element, "rx");
        OptionalDouble ry = SVGAttributes.doubleValue(element, "ry");
        if (rx.isEmpty() || ry.isEmpty()
                || !(rx.getAsDouble() > 0 && ry.getAsDouble() > 0))
            return Optional.empty();

        Ellipse ellipse = new Ellipse(SVGAttributes.doubleValue(element, "cx", 0),
                                      SVGAttributes.doubleValue(element, "cy", 0),
                                      rx.getAsDouble(), ry.getAsDouble());
        return Optional.of(ellipse.arc(0, FULL_TURN));
    }

    private Optional<SceneNode> image(MarkupElement element,
                                      Map<String, String> style,
                                      Transform place) {
        Optional<String> href = ReferenceResolver.href(element);
        if (href.isEmpty()) {
            diagnostics.fine(element.name(), "Missing image reference");
            return Optional.empty();
        }
        return Optional.of(new Image(href.get(), Align.MIN, Align.MIN, AspectRatio.NONE,
                SVGAttributes.doubleValue(element, "width", 0),
                SVGAttributes.doubleValue(element, "height", 0),
                place.move(SVGAttributes.doubleValue(element, "x", 0),
                           SVGAttributes.doubleValue(element, "y", 0)),
                styles.opacity(style), SVGAttributes.tags(element)));
    }

}
