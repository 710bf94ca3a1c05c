/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import java.util.Locale;

import io.github.stanio.svgscene.paint.Font;

/**
 * Supplies the advance width of a text run, used to place the run
 * following it.
 */
@FunctionalInterface
public interface TextMeasure {

    double width(String text, Font font);

    /**
     * {@return a measure assuming every character is half the font size
     * wide}
     */
    static TextMeasure approximate() {
        return (text, font) -> 0.5 * font.size() * text.length();
    }

    /**
     * {@return a measure using the string bounds of the matching
     * {@code java.awt.Font}}
     */
    static TextMeasure awt() {
        return new AwtTextMeasure();
    }

    /**
     * @param   name  {@code approximate} or {@code awt} (case-insensitive)
     * @return  the named measure
     * @throws  IllegalArgumentException  if {@code name} is not recognized
     */
    static TextMeasure forName(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
        case "approximate":
            return approximate();
        case "awt":
            return awt();
        default:
            throw new IllegalArgumentException("Unknown text measure: " + name);
        }
    }

}
