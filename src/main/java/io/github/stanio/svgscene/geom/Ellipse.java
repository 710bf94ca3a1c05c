/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.geom;

import java.util.Objects;

public final class Ellipse extends Locus {

    private final double cx;
    private final double cy;
    private final double rx;
    private final double ry;

    public Ellipse(double cx, double cy, double rx, double ry) {
        this.cx = cx;
        this.cy = cy;
        this.rx = rx;
        this.ry = ry;
    }

    public double cx() { return cx; }
    public double cy() { return cy; }
    public double rx() { return rx; }
    public double ry() { return ry; }

    public Arc arc(double shift, double extent) {
        return new Arc(this, shift, extent);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitEllipse(this);
    }

    @Override
    public Rect bounds() {
        return new Rect(cx - rx, cy - ry, rx * 2, ry * 2);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        if (!(obj instanceof Ellipse))
            return false;

        Ellipse other = (Ellipse) obj;
        return Double.compare(cx, other.cx) == 0
                && Double.compare(cy, other.cy) == 0
                && Double.compare(rx, other.rx) == 0
                && Double.compare(ry, other.ry) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cx, cy, rx, ry);
    }

    @Override
    public String toString() {
        return "Ellipse(cx: " + cx + ", cy: " + cy
                + ", rx: " + rx + ", ry: " + ry + ")";
    }

}
