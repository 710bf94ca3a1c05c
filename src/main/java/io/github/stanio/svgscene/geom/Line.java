/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.geom;

import java.util.Objects;

public final class Line extends Locus {

    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;

    public Line(double x1, double y1, double x2, double y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public double x1() { return x1; }
    public double y1() { return y1; }
    public double x2() { return x2; }
    public double y2() { return y2; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLine(this);
    }

    @Override
    public Rect bounds() {
        return new Rect(Math.min(x1, x2), Math.min(y1, y2),
                        Math.abs(x2 - x1), Math.abs(y2 - y1));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        if (!(obj instanceof Line))
            return false;

        Line other = (Line) obj;
        return Double.compare(x1, other.x1) == 0
                && Double.compare(y1, other.y1) == 0
                && Double.compare(x2, other.x2) == 0
                && Double.compare(y2, other.y2) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x1, y1, x2, y2);
    }

    @Override
    public String toString() {
        return "Line(" + x1 + ", " + y1 + " -> " + x2 + ", " + y2 + ")";
    }

}
