/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.geom;

/**
 * Immutable geometric description in local (untransformed) coordinates.
 * The set of variants is closed: all subclasses live in this package, and
 * consumers dispatch on the concrete type through a {@link Visitor}.
 */
public abstract class Locus {

    /**
     * Adding a {@code Locus} variant adds a method here, which every visitor
     * implementation then has to handle.
     *
     * @param  <R>  the visit result type
     */
    public interface Visitor<R> {
        R visitPath(Path path);
        R visitRect(Rect rect);
        R visitRoundRect(RoundRect roundRect);
        R visitCircle(Circle circle);
        R visitEllipse(Ellipse ellipse);
        R visitArc(Arc arc);
        R visitPolygon(Polygon polygon);
        R visitPolyline(Polyline polyline);
        R visitLine(Line line);
    }

    Locus() {
        // package-private: closed hierarchy
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public abstract Rect bounds();

}
