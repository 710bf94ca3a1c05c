/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import java.util.Map;
import java.util.Optional;

import io.github.stanio.svgscene.geom.Locus;
import io.github.stanio.svgscene.geom.Transform;
import io.github.stanio.svgscene.markup.MarkupElement;
import io.github.stanio.svgscene.paint.Fill;
import io.github.stanio.svgscene.paint.Stroke;
import io.github.stanio.svgscene.scene.Group;
import io.github.stanio.svgscene.scene.Image;
import io.github.stanio.svgscene.scene.SceneNode;
import io.github.stanio.svgscene.scene.SceneNodes;
import io.github.stanio.svgscene.scene.Shape;
import io.github.stanio.svgscene.scene.Text;

/**
 * Resolves references to definitions: {@code use} instantiation and
 * {@code mask} application.
 */
final class ReferenceResolver {

    private final DefinitionRegistry definitions;
    private final StyleResolver styles;
    private final TransformParser transforms;
    private final Diagnostics diagnostics;
    private final int maxDepth;

    private int depthMark;

    ReferenceResolver(DefinitionRegistry definitions,
                      StyleResolver styles,
                      TransformParser transforms,
                      Diagnostics diagnostics,
                      int maxDepth) {
        this.definitions = definitions;
        this.styles = styles;
        this.transforms = transforms;
        this.diagnostics = diagnostics;
        this.maxDepth = maxDepth;
    }

    /**
     * Extracts the id from an {@code #id} or {@code url(#id)} reference.
     *
     * @param   ref  the reference text
     * @return  the referenced id, or empty if {@code ref} is blank or
     *          malformed
     */
    static Optional<String> id(String ref) {
        String token = ref.strip();
        if (token.startsWith("url")) {
            int open = token.indexOf('(');
            int close = token.lastIndexOf(')');
            if (open < 0 || close < open)
                return Optional.empty();

            token = token.substring(open + 1, close).strip();
        }
        if (token.startsWith("#")) {
            token = token.substring(1).strip();
        }
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    /**
     * {@return the {@code xlink:href} or {@code href} attribute value}
     */
    static Optional<String> href(MarkupElement element) {
        Optional<String> href = element.attribute("xlink:href");
        return href.isPresent() ? href : element.attribute("href");
    }

    /**
     * Resets the deepest reference chain recorded since.
     *
     * @see  #depthMark()
     */
    void resetDepthMark() {
        depthMark = 0;
    }

    /**
     * {@return the deepest {@code use} reference chain instantiated since
     * the last reset}
     */
    int depthMark() {
        return depthMark;
    }

    /**
     * Creates an independent copy of the node a {@code use} element
     * references, placed and styled by the {@code use} element.
     *
     * @param   use  the {@code use} element
     * @param   style  the resolved style of {@code use}
     * @return  the instance, or empty if the reference doesn't resolve
     */
    Optional<SceneNode> instantiate(MarkupElement use, Map<String, String> style) {
        String element = use.name();
        Optional<String> href = href(use);
        if (href.isEmpty()) {
            diagnostics.warning(element, "Missing reference");
            return Optional.empty();
        }

        Optional<String> id = id(href.get());
        Optional<SceneNode> source = id.flatMap(definitions::node);
        if (source.isEmpty()) {
            diagnostics.warning(element, "Unresolved reference: {0}", href.get());
            return Optional.empty();
        }

        int depth = definitions.nodeDepth(id.get()) + 1;
        if (depth > maxDepth) {
            diagnostics.warning(element, "Reference chain to {0} exceeds {1} levels",
                                href.get(), String.valueOf(maxDepth));
            return Optional.empty();
        }
        depthMark = Math.max(depthMark, depth);

        SceneNode instance = SceneNodes.deepCopy(source.get());
        Transform place = transforms.parse(use.attribute("transform").orElse(null), element)
                .move(SVGAttributes.doubleValue(use, "x", 0),
                      SVGAttributes.doubleValue(use, "y", 0));
        instance.setPlace(place);
        instance.setOpacity(styles.opacity(style));

        Shape mask = use.attribute("mask")
                        .flatMap(ref -> resolveMask(ref, element))
                        .orElse(null);
        Fill fill = styles.fill(style, element);
        boolean overrideFill = style.containsKey("fill")
                && (fill != null || style.get("fill").strip().equals("none"));
        instance.accept(new UseOverride(overrideFill, fill,
                                        styles.stroke(style, element),
                                        (mask == null) ? null : mask.form()));
        return Optional.of(instance);
    }

    /**
     * Clips the shape with the referenced mask outline, clearing its fill.
     *
     * @param   shape  the shape to mask
     * @param   ref  a {@code url(#id)} mask reference
     * @param   element  the name of the element being compiled
     */
    void applyMask(Shape shape, String ref, String element) {
        resolveMask(ref, element).ifPresent(mask -> {
            shape.setClip(mask.form());
            shape.setFill(null);
        });
    }

    private Optional<Shape> resolveMask(String ref, String element) {
        Optional<Shape> mask = id(ref).flatMap(definitions::mask);
        if (mask.isEmpty()) {
            diagnostics.warning(element, "Unresolved mask reference: {0}", ref);
        }
        return mask;
    }


    private static class UseOverride implements SceneNode.Visitor<Void> {

        private final boolean overrideFill;
        private final Fill fill;
        private final Stroke stroke;
        private final Locus clip;

        UseOverride(boolean overrideFill, Fill fill, Stroke stroke, Locus clip) {
            this.overrideFill = overrideFill;
            this.fill = fill;
            this.stroke = stroke;
            this.clip = clip;
        }

        @Override
        public Void visitGroup(Group group) {
            for (SceneNode child : group.contents()) {
                child.accept(this);
            }
            return null;
        }

        @Override
        public Void visitShape(Shape shape) {
            if (overrideFill) {
                shape.setFill(fill);
            }
            if (stroke != null) {
                shape.setStroke(stroke);
            }
            if (clip != null) {
                shape.setClip(clip);
                shape.setFill(null);
            }
            return null;
        }

        @Override
        public Void visitText(Text text) {
            if (overrideFill && fill != null) {
                text.setFill(fill);
            }
            return null;
        }

        @Override
        public Void visitImage(Image image) {
            return null;
        }

    } // class UseOverride


}
