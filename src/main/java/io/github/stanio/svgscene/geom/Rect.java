/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.geom;

public final class Rect extends Locus {

    private final double x;
    private final double y;
    private final double w;
    private final double h;

    public Rect(double x, double y, double w, double h) {
        this.x = x;
        this.y = y;
        this.w = w;
        this.h = h;
    }

    public double x() { return x; }
    public double y() { return y; }
    public double w() { return w; }
    public double h() { return h; }

    public Rect union(Rect other) {
        double minX = Math.min(x, other.x);
        double minY = Math.min(y, other.y);
        double maxX = Math.max(x + w, other.x + other.w);
        double maxY = Math.max(y + h, other.y + other.h);
        return new Rect(minX, minY, maxX - minX, maxY - minY);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRect(this);
    }

    @Override
    public Rect bounds() {
        return this;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        if (!(obj instanceof Rect))
            return false;

        Rect other = (Rect) obj;
        return Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0
                && Double.compare(w, other.w) == 0
                && Double.compare(h, other.h) == 0;
    }

    @Override
    public int hashCode() {
        int hash = Double.hashCode(x);
        hash = 31 * hash + Double.hashCode(y);
        hash = 31 * hash + Double.hashCode(w);
        return 31 * hash + Double.hashCode(h);
    }

    @Override
    public String toString() {
        return "Rect(x: " + x + ", y: " + y + ", w: " + w + ", h: " + h + ")";
    }

}
