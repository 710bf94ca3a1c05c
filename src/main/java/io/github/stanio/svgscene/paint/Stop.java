/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.paint;

import java.util.Objects;

/**
 * One {@code (offset, color)} sample of a gradient color ramp.
 */
public final class Stop {

    private final double offset;
    private final Color color;

    /**
     * @throws  IllegalArgumentException  if {@code offset} is outside the
     *          {@code [0, 1]} range
     */
    public Stop(double offset, Color color) {
        if (!(offset >= 0 && offset <= 1)) {
            throw new IllegalArgumentException("offset out of [0, 1]: " + offset);
        }
        this.offset = offset;
        this.color = Objects.requireNonNull(color, "null color");
    }

    public double offset() {
        return offset;
    }

    public Color color() {
        return color;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        if (!(obj instanceof Stop))
            return false;

        Stop other = (Stop) obj;
        return Double.compare(offset, other.offset) == 0
                && color.equals(other.color);
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(offset) + color.hashCode();
    }

    @Override
    public String toString() {
        return "Stop(" + offset + ", " + color + ")";
    }

}
