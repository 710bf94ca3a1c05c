/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.paint;

/**
 * Paint for the interior of a shape or text, or for a stroke.  Closed set
 * of variants: {@link Color}, {@link LinearGradient}, {@link RadialGradient}.
 */
public abstract class Fill {

    public interface Visitor<R> {
        R visitColor(Color color);
        R visitLinearGradient(LinearGradient gradient);
        R visitRadialGradient(RadialGradient gradient);
    }

    Fill() {
        // package-private: closed hierarchy
    }

    public abstract <R> R accept(Visitor<R> visitor);

}
