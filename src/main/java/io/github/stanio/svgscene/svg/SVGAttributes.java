/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.github.stanio.svgscene.markup.MarkupElement;

/**
 * Numeric attribute values.
 */
final class SVGAttributes {

    private static final Pattern NUMBER =
            Pattern.compile("[-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?");

    private SVGAttributes() {}

    /**
     * Parses a plain number, or a number with a {@code px} unit suffix.
     * Surrounding whitespace is ignored.
     */
    static OptionalDouble parseDouble(String value) {
        String token = value.strip();
        if (token.endsWith("px")) {
            token = token.substring(0, token.length() - 2);
        }
        if (!NUMBER.matcher(token).matches())
            return OptionalDouble.empty();

        return OptionalDouble.of(Double.parseDouble(token));
    }

    /**
     * Parses a number or a percentage; percentages are divided by 100.
     */
    static OptionalDouble parsePercent(String value) {
        String token = value.strip();
        if (token.endsWith("%")) {
            OptionalDouble percent = parseDouble(token.substring(0, token.length() - 1));
            return percent.isPresent() ? OptionalDouble.of(percent.getAsDouble() / 100)
                                       : percent;
        }
        return parseDouble(token);
    }

    /**
     * Parses the leading number of a length value, ignoring any unit
     * suffix: {@code "2.5mm"} &rarr; 2.5.
     */
    static OptionalDouble parseLength(String value) {
        Matcher m = NUMBER.matcher(value.strip());
        return m.lookingAt() ? OptionalDouble.of(Double.parseDouble(m.group()))
                             : OptionalDouble.empty();
    }

    static OptionalDouble doubleValue(MarkupElement element, String name) {
        Optional<String> value = element.attribute(name);
        return value.isPresent() ? parseDouble(value.get())
                                 : OptionalDouble.empty();
    }

    static double doubleValue(MarkupElement element, String name, double defaultValue) {
        return doubleValue(element, name).orElse(defaultValue);
    }

    static OptionalDouble percentValue(MarkupElement element, String name) {
        Optional<String> value = element.attribute(name);
        return value.isPresent() ? parsePercent(value.get())
                                 : OptionalDouble.empty();
    }

    static double[] points(String value) {
        return NumberScanner.numbers(value);
    }

    /**
     * {@return a single-element list with the element {@code id}, or an
     * empty list}
     */
    static List<String> tags(MarkupElement element) {
        return element.attribute("id")
                      .map(Collections::singletonList)
                      .orElse(Collections.emptyList());
    }

}
