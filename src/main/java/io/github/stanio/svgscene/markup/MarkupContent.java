/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.markup;

import java.util.Objects;

/**
 * Item of mixed element content: either a run of character data, or
 * a child element.
 */
public final class MarkupContent {

    private final String text;
    private final MarkupElement element;

    private MarkupContent(String text, MarkupElement element) {
        this.text = text;
        this.element = element;
    }

    public static MarkupContent text(String text) {
        return new MarkupContent(Objects.requireNonNull(text), null);
    }

    public static MarkupContent element(MarkupElement element) {
        return new MarkupContent(null, Objects.requireNonNull(element));
    }

    public boolean isText() {
        return text != null;
    }

    /**
     * @throws  IllegalStateException  if this is element content
     */
    public String text() {
        if (text == null)
            throw new IllegalStateException("Not text content: " + element.name());

        return text;
    }

    /**
     * @throws  IllegalStateException  if this is text content
     */
    public MarkupElement element() {
        if (element == null)
            throw new IllegalStateException("Not element content");

        return element;
    }

    @Override
    public String toString() {
        return isText() ? "Text(\"" + text + "\")"
                        : "Element(" + element.name() + ")";
    }

}
