/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.geom;

import java.util.Objects;

/**
 * A section of an {@code Ellipse}.  {@code shift} is the start angle and
 * {@code extent} the angular length, both in radians; a full ellipse has
 * {@code extent = 2π}.
 */
public final class Arc extends Locus {

    private final Ellipse ellipse;
    private final double shift;
    private final double extent;

    public Arc(Ellipse ellipse, double shift, double extent) {
        this.ellipse = Objects.requireNonNull(ellipse, "null ellipse");
        this.shift = shift;
        this.extent = extent;
    }

    public Ellipse ellipse() { return ellipse; }
    public double shift() { return shift; }
    public double extent() { return extent; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitArc(this);
    }

    /**
     * Bounds of the full ellipse.
     */
    @Override
    public Rect bounds() {
        return ellipse.bounds();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        if (!(obj instanceof Arc))
            return false;

        Arc other = (Arc) obj;
        return ellipse.equals(other.ellipse)
                && Double.compare(shift, other.shift) == 0
                && Double.compare(extent, other.extent) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ellipse, shift, extent);
    }

    @Override
    public String toString() {
        return "Arc(" + ellipse + ", shift: " + shift + ", extent: " + extent + ")";
    }

}
