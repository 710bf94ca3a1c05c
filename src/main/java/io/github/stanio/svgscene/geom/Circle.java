/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.geom;

import java.util.Objects;

public final class Circle extends Locus {

    private final double cx;
    private final double cy;
    private final double r;

    public Circle(double cx, double cy, double r) {
        this.cx = cx;
        this.cy = cy;
        this.r = r;
    }

    public double cx() { return cx; }
    public double cy() { return cy; }
    public double r() { return r; }

    /**
     * @param   shift  start angle in radians
     * @param   extent  angular extent in radians
     */
    public Arc arc(double shift, double extent) {
        return new Arc(new Ellipse(cx, cy, r, r), shift, extent);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCircle(this);
    }

    @Override
    public Rect bounds() {
        return new Rect(cx - r, cy - r, r * 2, r * 2);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        if (!(obj instanceof Circle))
            return false;

        Circle other = (Circle) obj;
        return Double.compare(cx, other.cx) == 0
                && Double.compare(cy, other.cy) == 0
                && Double.compare(r, other.r) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cx, cy, r);
    }

    @Override
    public String toString() {
        return "Circle(cx: " + cx + ", cy: " + cy + ", r: " + r + ")";
    }

}
