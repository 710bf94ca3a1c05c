/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.paint;

import java.util.Objects;

public final class Font {

    private final String name;
    private final double size;

    public Font(String name, double size) {
        this.name = Objects.requireNonNull(name, "null name");
        this.size = size;
    }

    public String name() {
        return name;
    }

    public double size() {
        return size;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        if (!(obj instanceof Font))
            return false;

        Font other = (Font) obj;
        return name.equals(other.name)
                && Double.compare(size, other.size) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Double.hashCode(size);
    }

    @Override
    public String toString() {
        return "Font(" + name + ", " + size + ")";
    }

}
