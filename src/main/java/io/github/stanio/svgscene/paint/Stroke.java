/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.paint;

import java.util.Arrays;
import java.util.Objects;

public final class Stroke {

    private final Fill fill;
    private final double width;
    private final LineCap cap;
    private final LineJoin join;
    private final double[] dashes;

    public Stroke(Fill fill) {
        this(fill, 1, LineCap.SQUARE, LineJoin.MITER);
    }

    /**
     * @throws  IllegalArgumentException  if {@code width} or any of the
     *          {@code dashes} is negative
     */
    public Stroke(Fill fill, double width,
                  LineCap cap, LineJoin join, double... dashes) {
        if (!(width >= 0)) {
            throw new IllegalArgumentException("Invalid stroke width: " + width);
        }
        for (double length : dashes) {
            if (!(length >= 0))
                throw new IllegalArgumentException("Invalid dash length: " + length);
        }
        this.fill = Objects.requireNonNull(fill, "null fill");
        this.width = width;
        this.cap = Objects.requireNonNull(cap, "null cap");
        this.join = Objects.requireNonNull(join, "null join");
        this.dashes = dashes.clone();
    }

    public Fill fill() { return fill; }
    public double width() { return width; }
    public LineCap cap() { return cap; }
    public LineJoin join() { return join; }

    public double[] dashes() {
        return dashes.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        if (!(obj instanceof Stroke))
            return false;

        Stroke other = (Stroke) obj;
        return fill.equals(other.fill)
                && Double.compare(width, other.width) == 0
                && cap == other.cap
                && join == other.join
                && Arrays.equals(dashes, other.dashes);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(fill, width, cap, join) + Arrays.hashCode(dashes);
    }

    @Override
    public String toString() {
        return "Stroke(" + fill + ", width: " + width + ", " + cap + ", " + join
                + (dashes.length > 0 ? ", dashes: " + Arrays.toString(dashes) : "")
                + ")";
    }

}
