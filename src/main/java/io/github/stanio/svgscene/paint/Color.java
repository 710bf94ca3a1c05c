/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.paint;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Solid 32-bit ARGB color.
 */
public final class Color extends Fill {

    public static final Color BLACK = new Color(0xFF000000);
    public static final Color WHITE = new Color(0xFFFFFFFF);

    private static final Pattern RGB_FUNCTION = Pattern.compile(
            "rgb\\(\\s*([^,\\s]+)\\s*,\\s*([^,\\s]+)\\s*,\\s*([^,\\s)]+)\\s*\\)",
            Pattern.CASE_INSENSITIVE);

    private final int argb;

    private Color(int argb) {
        this.argb = argb;
    }

    public static Color argb(int argb) {
        return new Color(argb);
    }

    /**
     * @param   rgb  {@code 0xRRGGBB}
     * @return  fully opaque color
     */
    public static Color rgb(int rgb) {
        return new Color(0xFF000000 | rgb);
    }

    public static Color rgb(int r, int g, int b) {
        return rgba(r, g, b, 1.0);
    }

    /**
     * @param   opacity  alpha in the {@code [0, 1]} range; values outside
     *          the range are clamped
     */
    public static Color rgba(int r, int g, int b, double opacity) {
        return new Color(alpha(opacity) << 24
                | (r & 0xFF) << 16 | (g & 0xFF) << 8 | (b & 0xFF));
    }

    private static int alpha(double opacity) {
        return (int) Math.round(Math.max(0, Math.min(1, opacity)) * 255);
    }

    public int r() { return (argb >> 16) & 0xFF; }
    public int g() { return (argb >> 8) & 0xFF; }
    public int b() { return argb & 0xFF; }
    public int a() { return (argb >>> 24); }

    public int argb() {
        return argb;
    }

    public double opacity() {
        return a() / 255.0;
    }

    public Color withOpacity(double opacity) {
        return new Color(alpha(opacity) << 24 | (argb & 0xFFFFFF));
    }

    /**
     * Decodes a color keyword (case-insensitive), a hexadecimal
     * {@code #rgb} / {@code #rrggbb} value (the leading {@code #} may be
     * omitted), or an {@code rgb(r, g, b)} function with integer or
     * percentage components.
     *
     * @param   value  the color value to decode
     * @param   opacity  the alpha to apply to the decoded color
     * @return  the decoded color, or empty if {@code value} is not
     *          recognized
     */
    public static Optional<Color> decode(String value, double opacity) {
        String token = value.strip();
        Integer named = NamedColors.rgb(token.toLowerCase(Locale.ROOT));
        if (named != null) {
            return Optional.of(rgb(named).withOpacity(opacity));
        }

        Matcher function = RGB_FUNCTION.matcher(token);
        if (function.matches()) {
            try {
                return Optional.of(rgba(component(function.group(1)),
                                        component(function.group(2)),
                                        component(function.group(3)), opacity));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }

        String hex = token.startsWith("#") ? token.substring(1) : token;
        if (hex.length() == 3) {
            StringBuilder buf = new StringBuilder(6);
            for (int i = 0; i < 3; i++) {
                buf.append(hex.charAt(i)).append(hex.charAt(i));
            }
            hex = buf.toString();
        }
        if (hex.length() != 6)
            return Optional.empty();

        try {
            return Optional.of(rgb(Integer.parseInt(hex, 16)).withOpacity(opacity));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * @throws  NumberFormatException  if {@code value} is not a number
     */
    private static int component(String value) {
        double number = value.endsWith("%")
                ? Double.parseDouble(value.substring(0, value.length() - 1)) * 2.55
                : Double.parseDouble(value);
        if (Double.isNaN(number))
            throw new NumberFormatException("NaN color component");

        return (int) Math.round(Math.max(0, Math.min(255, number)));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitColor(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this || (obj instanceof Color
                && argb == ((Color) obj).argb);
    }

    @Override
    public int hashCode() {
        return argb;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Color(#%08X)", argb);
    }

}
