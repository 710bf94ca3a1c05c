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
import io.github.stanio.svgscene.markup.MarkupContent;
import io.github.stanio.svgscene.markup.MarkupElement;
import io.github.stanio.svgscene.paint.Font;
import io.github.stanio.svgscene.scene.Align;
import io.github.stanio.svgscene.scene.Baseline;
import io.github.stanio.svgscene.scene.Group;
import io.github.stanio.svgscene.scene.SceneNode;
import io.github.stanio.svgscene.scene.Text;

/**
 * Lays out {@code text} elements.
 * <p>
 * Text without child elements becomes a single {@code Text} node.  Text
 * with {@code tspan} children becomes a group of runs, each placed at the
 * right edge of the previous one unless positioned explicitly.  Whitespace
 * between runs collapses into a single leading space of the next run.</p>
 */
final class TextFlow {

    private final StyleResolver styles;
    private final TextMeasure measure;
    private final Diagnostics diagnostics;

    TextFlow(StyleResolver styles, TextMeasure measure, Diagnostics diagnostics) {
        this.styles = styles;
        this.measure = measure;
        this.diagnostics = diagnostics;
    }

    /**
     * @param   element  the {@code text} element
     * @param   style  the resolved style of {@code element}
     * @param   place  the element transform
     * @return  the text node, or empty if there's no text
     */
    Optional<SceneNode> layout(MarkupElement element,
                               Map<String, String> style,
                               Transform place) {
        double x = SVGAttributes.doubleValue(element, "x", 0);
        double y = SVGAttributes.doubleValue(element, "y", 0);
        if (element.children().isEmpty()) {
            return simpleText(element, style, place.move(x, y));
        }

        List<SceneNode> runs = new Flow(element, style, x, y).runs();
        if (runs.isEmpty()) {
            diagnostics.fine(element.name(), "No text content");
            return Optional.empty();
        }
        return Optional.of(new Group(runs, place, styles.opacity(style),
                                     SVGAttributes.tags(element)));
    }

    private Optional<SceneNode> simpleText(MarkupElement element,
                                           Map<String, String> style,
                                           Transform place) {
        String content = element.text().map(String::strip).orElse("");
        if (content.isEmpty()) {
            diagnostics.fine(element.name(), "No text content");
            return Optional.empty();
        }
        return Optional.of(new Text(content, styles.font(style),
                styles.textFill(style, element.name()), Align.MIN, Baseline.TOP,
                place, styles.opacity(style), SVGAttributes.tags(element)));
    }


    /**
     * Walks the mixed content of one {@code text} element.
     */
    private class Flow {

        private final MarkupElement element;
        private final Map<String, String> style;
        private final List<SceneNode> runs = new ArrayList<>();

        // Right edge of the last run
        private double cursorX;
        private double cursorY;
        private double cursorWidth;

        private boolean pendingSpace;

        Flow(MarkupElement element, Map<String, String> style, double x, double y) {
            this.element = element;
            this.style = style;
            this.cursorX = x;
            this.cursorY = y;
        }

        List<SceneNode> runs() {
            List<MarkupContent> content = element.content();
            for (int i = 0, len = content.size(); i < len; i++) {
                MarkupContent item = content.get(i);
                if (item.isText()) {
                    textRun(item.text());
                } else if (item.element().name().equals("tspan")) {
                    tspan(item.element());
                    pendingSpace = i + 1 < len && content.get(i + 1).isText()
                            && startsWithSpace(content.get(i + 1).text());
                } else {
                    diagnostics.fine(item.element().name(),
                                     "Unsupported text content skipped");
                }
            }
            return runs;
        }

        private void textRun(String raw) {
            String content = raw.strip();
            if (content.isEmpty()) {
                pendingSpace = !runs.isEmpty();
                return;
            }

            String text = pendingSpace ? " " + content : content;
            Font font = styles.font(style);
            add(new Text(text, font, styles.textFill(style, element.name()),
                         Align.MIN, Baseline.ALPHABETIC,
                         Transform.translation(cursorX + cursorWidth, cursorY),
                         1.0, Collections.emptyList()),
                cursorX + cursorWidth, cursorY);
            pendingSpace = raw.stripTrailing().length() != raw.length();
        }

        private void tspan(MarkupElement tspan) {
            Optional<String> content = tspan.text();
            if (content.isEmpty() || content.get().isEmpty()) {
                diagnostics.fine(tspan.name(), "No text content");
                return;
            }

            double x;
            OptionalDouble absX = SVGAttributes.doubleValue(tspan, "x");
            if (absX.isPresent()) {
                x = absX.getAsDouble();
                pendingSpace = false;
            } else {
                x = cursorX + cursorWidth + SVGAttributes.doubleValue(tspan, "dx", 0);
            }
            double y = SVGAttributes.doubleValue(tspan, "y")
                    .orElse(cursorY + SVGAttributes.doubleValue(tspan, "dy", 0));

            String text = pendingSpace ? " " + content.get() : content.get();
            Map<String, String> tspanStyle = StyleResolver.resolve(style, tspan);
            Map<String, String> ownStyle = StyleResolver.resolve(Collections.emptyMap(), tspan);
            add(new Text(text, styles.font(tspanStyle),
                         styles.textFill(tspanStyle, tspan.name()),
                         Align.MIN, Baseline.ALPHABETIC,
                         Transform.translation(x, y),
                         styles.opacity(ownStyle), SVGAttributes.tags(tspan)),
                x, y);
        }

        private void add(Text run, double x, double y) {
            runs.add(run);
            cursorX = x;
            cursorY = y;
            cursorWidth = measure.width(run.text(), run.font());
        }

    } // class Flow


    static boolean startsWithSpace(String text) {
        return !text.isEmpty() && Character.isWhitespace(text.charAt(0));
    }

}
