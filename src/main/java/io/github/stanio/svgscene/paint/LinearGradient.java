/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.paint;

import java.util.List;
import java.util.Objects;

import io.github.stanio.svgscene.geom.Transform;

public final class LinearGradient extends Gradient {

    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;

    public LinearGradient(double x1, double y1, double x2, double y2,
                          boolean userSpace, List<Stop> stops) {
        this(x1, y1, x2, y2, userSpace, stops, Transform.IDENTITY);
    }

    public LinearGradient(double x1, double y1, double x2, double y2,
                          boolean userSpace, List<Stop> stops,
                          Transform transform) {
        super(stops, userSpace, transform);
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
        return visitor.visitLinearGradient(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        if (!(obj instanceof LinearGradient))
            return false;

        LinearGradient other = (LinearGradient) obj;
        return Double.compare(x1, other.x1) == 0
                && Double.compare(y1, other.y1) == 0
                && Double.compare(x2, other.x2) == 0
                && Double.compare(y2, other.y2) == 0
                && baseEquals(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x1, y1, x2, y2, baseHashCode());
    }

    @Override
    public String toString() {
        return "LinearGradient(" + x1 + ", " + y1 + " -> " + x2 + ", " + y2
                + ", userSpace: " + userSpace() + ", " + stops() + ")";
    }

}
