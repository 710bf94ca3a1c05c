/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.cli;

import java.util.Locale;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import io.github.stanio.svgscene.geom.Arc;
import io.github.stanio.svgscene.geom.Circle;
import io.github.stanio.svgscene.geom.Ellipse;
import io.github.stanio.svgscene.geom.Line;
import io.github.stanio.svgscene.geom.Locus;
import io.github.stanio.svgscene.geom.Path;
import io.github.stanio.svgscene.geom.PathSegment;
import io.github.stanio.svgscene.geom.Polygon;
import io.github.stanio.svgscene.geom.Polyline;
import io.github.stanio.svgscene.geom.Rect;
import io.github.stanio.svgscene.geom.RoundRect;
import io.github.stanio.svgscene.geom.Transform;
import io.github.stanio.svgscene.paint.Color;
import io.github.stanio.svgscene.paint.Fill;
import io.github.stanio.svgscene.paint.Gradient;
import io.github.stanio.svgscene.paint.LinearGradient;
import io.github.stanio.svgscene.paint.RadialGradient;
import io.github.stanio.svgscene.paint.Stop;
import io.github.stanio.svgscene.paint.Stroke;
import io.github.stanio.svgscene.scene.Group;
import io.github.stanio.svgscene.scene.Image;
import io.github.stanio.svgscene.scene.SceneNode;
import io.github.stanio.svgscene.scene.Shape;
import io.github.stanio.svgscene.scene.Text;

/**
 * Converts scene graphs to JSON trees.  Properties with default values
 * (identity placement, full opacity, visible, no clip) are omitted.
 */
final class SceneJson implements SceneNode.Visitor<JsonObject> {

    private final LocusJson locusJson = new LocusJson();
    private final FillJson fillJson = new FillJson();

    static JsonObject toJson(SceneNode node) {
        return node.accept(new SceneJson());
    }

    private JsonObject node(String type, SceneNode node) {
        JsonObject json = new JsonObject();
        json.addProperty("type", type);
        if (!node.tags().isEmpty()) {
            JsonArray tags = new JsonArray();
            node.tags().forEach(tags::add);
            json.add("tags", tags);
        }
        if (!node.place().isIdentity()) {
            json.add("place", transform(node.place()));
        }
        if (node.opacity() != 1) {
            json.addProperty("opacity", node.opacity());
        }
        if (!node.visible()) {
            json.addProperty("visible", false);
        }
        node.clip().ifPresent(clip -> json.add("clip", clip.accept(locusJson)));
        return json;
    }

    @Override
    public JsonObject visitGroup(Group group) {
        JsonObject json = node("group", group);
        JsonArray contents = new JsonArray();
        for (SceneNode child : group.contents()) {
            contents.add(child.accept(this));
        }
        json.add("contents", contents);
        return json;
    }

    @Override
    public JsonObject visitShape(Shape shape) {
        JsonObject json = node("shape", shape);
        json.add("form", shape.form().accept(locusJson));
        shape.fill().ifPresent(fill -> json.add("fill", fill.accept(fillJson)));
        shape.stroke().ifPresent(stroke -> json.add("stroke", stroke(stroke)));
        return json;
    }

    @Override
    public JsonObject visitText(Text text) {
        JsonObject json = node("text", text);
        json.addProperty("text", text.text());
        json.addProperty("font", text.font().name());
        json.addProperty("fontSize", text.font().size());
        json.add("fill", text.fill().accept(fillJson));
        json.addProperty("align", text.align().name());
        json.addProperty("baseline", text.baseline().name());
        return json;
    }

    @Override
    public JsonObject visitImage(Image image) {
        JsonObject json = node("image", image);
        json.addProperty("src", image.src());
        json.addProperty("w", image.w());
        json.addProperty("h", image.h());
        json.addProperty("xAlign", image.xAlign().name());
        json.addProperty("yAlign", image.yAlign().name());
        json.addProperty("aspectRatio", image.aspectRatio().name());
        return json;
    }

    private JsonObject stroke(Stroke stroke) {
        JsonObject json = new JsonObject();
        json.add("fill", stroke.fill().accept(fillJson));
        json.addProperty("width", stroke.width());
        json.addProperty("cap", stroke.cap().name());
        json.addProperty("join", stroke.join().name());
        if (stroke.dashes().length > 0) {
            json.add("dashes", numbers(stroke.dashes()));
        }
        return json;
    }

    static JsonArray transform(Transform transform) {
        return numbers(transform.m11(), transform.m12(),
                       transform.m21(), transform.m22(),
                       transform.dx(), transform.dy());
    }

    static JsonArray numbers(double... values) {
        JsonArray array = new JsonArray(values.length);
        for (double value : values) {
            array.add(value);
        }
        return array;
    }

    /**
     * {@code #rrggbb}, or {@code #rrggbbaa} when not fully opaque.
     */
    static String color(Color color) {
        String rgb = String.format(Locale.ROOT, "#%06x", color.argb() & 0xFFFFFF);
        return (color.a() == 0xFF) ? rgb
                                   : rgb + String.format(Locale.ROOT, "%02x", color.a());
    }


    private static class LocusJson implements Locus.Visitor<JsonObject> {

        private static JsonObject locus(String type) {
            JsonObject json = new JsonObject();
            json.addProperty("type", type);
            return json;
        }

        @Override
        public JsonObject visitPath(Path path) {
            JsonObject json = locus("path");
            JsonArray segments = new JsonArray();
            for (PathSegment item : path.segments()) {
                JsonArray segment = new JsonArray();
                segment.add(item.type().name());
                for (double value : item.data()) {
                    segment.add(value);
                }
                segments.add(segment);
            }
            json.add("segments", segments);
            return json;
        }

        @Override
        public JsonObject visitRect(Rect rect) {
            JsonObject json = locus("rect");
            json.addProperty("x", rect.x());
            json.addProperty("y", rect.y());
            json.addProperty("w", rect.w());
            json.addProperty("h", rect.h());
            return json;
        }

        @Override
        public JsonObject visitRoundRect(RoundRect roundRect) {
            JsonObject json = visitRect(roundRect.rect());
            json.addProperty("type", "roundRect");
            json.addProperty("rx", roundRect.rx());
            json.addProperty("ry", roundRect.ry());
            return json;
        }

        @Override
        public JsonObject visitCircle(Circle circle) {
            JsonObject json = locus("circle");
            json.addProperty("cx", circle.cx());
            json.addProperty("cy", circle.cy());
            json.addProperty("r", circle.r());
            return json;
        }

        @Override
        public JsonObject visitEllipse(Ellipse ellipse) {
            JsonObject json = locus("ellipse");
            json.addProperty("cx", ellipse.cx());
            json.addProperty("cy", ellipse.cy());
            json.addProperty("rx", ellipse.rx());
            json.addProperty("ry", ellipse.ry());
            return json;
        }

        @Override
        public JsonObject visitArc(Arc arc) {
            JsonObject json = visitEllipse(arc.ellipse());
            json.addProperty("type", "arc");
            json.addProperty("shift", arc.shift());
            json.addProperty("extent", arc.extent());
            return json;
        }

        @Override
        public JsonObject visitPolygon(Polygon polygon) {
            JsonObject json = locus("polygon");
            json.add("points", numbers(polygon.points()));
            return json;
        }

        @Override
        public JsonObject visitPolyline(Polyline polyline) {
            JsonObject json = locus("polyline");
            json.add("points", numbers(polyline.points()));
            return json;
        }

        @Override
        public JsonObject visitLine(Line line) {
            JsonObject json = locus("line");
            json.addProperty("x1", line.x1());
            json.addProperty("y1", line.y1());
            json.addProperty("x2", line.x2());
            json.addProperty("y2", line.y2());
            return json;
        }

    } // class LocusJson


    private static class FillJson implements Fill.Visitor<JsonElement> {

        @Override
        public JsonElement visitColor(Color color) {
            return new JsonPrimitive(color(color));
        }

        private static JsonObject gradient(String type, Gradient gradient) {
            JsonObject json = new JsonObject();
            json.addProperty("type", type);
            json.addProperty("userSpace", gradient.userSpace());
            if (!gradient.transform().isIdentity()) {
                json.add("transform", transform(gradient.transform()));
            }
            JsonArray stops = new JsonArray();
            for (Stop item : gradient.stops()) {
                JsonObject stop = new JsonObject();
                stop.addProperty("offset", item.offset());
                stop.addProperty("color", color(item.color()));
                stops.add(stop);
            }
            json.add("stops", stops);
            return json;
        }

        @Override
        public JsonElement visitLinearGradient(LinearGradient gradient) {
            JsonObject json = gradient("linearGradient", gradient);
            json.addProperty("x1", gradient.x1());
            json.addProperty("y1", gradient.y1());
            json.addProperty("x2", gradient.x2());
            json.addProperty("y2", gradient.y2());
            return json;
        }

        @Override
        public JsonElement visitRadialGradient(RadialGradient gradient) {
            JsonObject json = gradient("radialGradient", gradient);
            json.addProperty("cx", gradient.cx());
            json.addProperty("cy", gradient.cy());
            json.addProperty("fx", gradient.fx());
            json.addProperty("fy", gradient.fy());
            json.addProperty("r", gradient.r());
            return json;
        }

    } // class FillJson


}
