/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.geom;

import java.util.Objects;

public final class RoundRect extends Locus {

    private final Rect rect;
    private final double rx;
    private final double ry;

    public RoundRect(Rect rect, double rx, double ry) {
        this.rect = Objects.requireNonNull(rect, "null rect");
        this.rx = rx;
        this.ry = ry;
    }

    public Rect rect() { return rect; }
    public double rx() { return rx; }
    public double ry() { return ry; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRoundRect(this);
    }

    @Override
    public Rect bounds() {
        return rect;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        if (!(obj instanceof RoundRect))
            return false;

        RoundRect other = (RoundRect) obj;
        return rect.equals(other.rect)
                && Double.compare(rx, other.rx) == 0
                && Double.compare(ry, other.ry) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rect, rx, ry);
    }

    @Override
    public String toString() {
        return "RoundRect(" + rect + ", rx: " + rx + ", ry: " + ry + ")";
    }

}
