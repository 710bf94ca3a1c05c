/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.geom;

import java.util.Arrays;

/**
 * Open outline through {@code x,y} coordinate pairs.
 */
public final class Polyline extends Locus {

    private final double[] points;

    /**
     * @param   points  flat {@code x0, y0, x1, y1, ...} sequence; a trailing
     *          odd coordinate is kept but doesn't count toward the bounds
     */
    public Polyline(double... points) {
        this.points = points.clone();
    }

    public double[] points() {
        return points.clone();
    }

    public int pointCount() {
        return points.length / 2;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPolyline(this);
    }

    @Override
    public Rect bounds() {
        return Path.pointBounds(points, points.length - points.length % 2);
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this || (obj instanceof Polyline
                && Arrays.equals(points, ((Polyline) obj).points));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(points);
    }

    @Override
    public String toString() {
        return "Polyline" + Arrays.toString(points);
    }

}
