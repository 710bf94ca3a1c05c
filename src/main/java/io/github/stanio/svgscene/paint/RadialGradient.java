/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.paint;

import java.util.List;
import java.util.Objects;

import io.github.stanio.svgscene.geom.Transform;

public final class RadialGradient extends Gradient {

    private final double cx;
    private final double cy;
    private final double fx;
    private final double fy;
    private final double r;

    public RadialGradient(double cx, double cy, double fx, double fy, double r,
                          boolean userSpace, List<Stop> stops) {
        this(cx, cy, fx, fy, r, userSpace, stops, Transform.IDENTITY);
    }

    public RadialGradient(double cx, double cy, double fx, double fy, double r,
                          boolean userSpace, List<Stop> stops,
                          Transform transform) {
        super(stops, userSpace, transform);
        this.cx = cx;
        this.cy = cy;
        this.fx = fx;
        this.fy = fy;
        this.r = r;
    }

    public double cx() { return cx; }
    public double cy() { return cy; }
    public double fx() { return fx; }
    public double fy() { return fy; }
    public double r() { return r; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRadialGradient(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        if (!(obj instanceof RadialGradient))
            return false;

        RadialGradient other = (RadialGradient) obj;
        return Double.compare(cx, other.cx) == 0
                && Double.compare(cy, other.cy) == 0
                && Double.compare(fx, other.fx) == 0
                && Double.compare(fy, other.fy) == 0
                && Double.compare(r, other.r) == 0
                && baseEquals(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cx, cy, fx, fy, r, baseHashCode());
    }

    @Override
    public String toString() {
        return "RadialGradient(c: " + cx + ", " + cy + ", f: " + fx + ", " + fy
                + ", r: " + r + ", userSpace: " + userSpace() + ", " + stops() + ")";
    }

}
