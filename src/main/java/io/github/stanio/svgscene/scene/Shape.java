/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.scene;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.github.stanio.svgscene.geom.Locus;
import io.github.stanio.svgscene.geom.Transform;
import io.github.stanio.svgscene.paint.Fill;
import io.github.stanio.svgscene.paint.Stroke;

public final class Shape extends SceneNode {

    private Locus form;
    private Fill fill;
    private Stroke stroke;

    public Shape(Locus form, Fill fill, Stroke stroke) {
        this(form, fill, stroke, Transform.IDENTITY, 1.0, Collections.emptyList());
    }

    /**
     * @param   fill  may be {@code null}
     * @param   stroke  may be {@code null}
     */
    public Shape(Locus form, Fill fill, Stroke stroke,
                 Transform place, double opacity, List<String> tags) {
        super(place, opacity, tags);
        this.form = Objects.requireNonNull(form, "null form");
        this.fill = fill;
        this.stroke = stroke;
    }

    Shape(Shape source) {
        super(source);
        this.form = source.form;
        this.fill = source.fill;
        this.stroke = source.stroke;
    }

    public Locus form() {
        return form;
    }

    public void setForm(Locus form) {
        this.form = Objects.requireNonNull(form, "null form");
    }

    public Optional<Fill> fill() {
        return Optional.ofNullable(fill);
    }

    public void setFill(Fill fill) {
        this.fill = fill;
    }

    public Optional<Stroke> stroke() {
        return Optional.ofNullable(stroke);
    }

    public void setStroke(Stroke stroke) {
        this.stroke = stroke;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitShape(this);
    }

    @Override
    public String toString() {
        return "Shape(" + form
                + (fill == null ? "" : ", fill: " + fill)
                + (stroke == null ? "" : ", stroke: " + stroke)
                + ", " + baseToString() + ")";
    }

}
