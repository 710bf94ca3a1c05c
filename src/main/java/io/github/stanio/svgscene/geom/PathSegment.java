/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.geom;

import java.util.Arrays;
import java.util.Objects;

public final class PathSegment {

    private final PathSegmentType type;
    private final double[] data;

    /**
     * @throws  IllegalArgumentException  if the number of operands doesn't
     *          match {@code type.arity()}
     */
    public PathSegment(PathSegmentType type, double... data) {
        this.type = Objects.requireNonNull(type, "null type");
        if (data.length != type.arity()) {
            throw new IllegalArgumentException(type + " takes "
                    + type.arity() + " operand(s), got " + data.length);
        }
        this.data = data.clone();
    }

    public PathSegmentType type() {
        return type;
    }

    public double[] data() {
        return data.clone();
    }

    public double data(int index) {
        return data[index];
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        if (!(obj instanceof PathSegment))
            return false;

        PathSegment other = (PathSegment) obj;
        return type == other.type && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder(type.name());
        for (double value : data) {
            buf.append(' ').append(value);
        }
        return buf.toString();
    }

}
