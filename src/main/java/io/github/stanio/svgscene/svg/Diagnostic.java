/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import java.util.Objects;
import java.util.logging.Level;

/**
 * A problem local to a single element that didn't abort compilation.
 * The element (or attribute value) in question produced no node or value.
 */
public final class Diagnostic {

    private final String element;
    private final String message;
    private final Level level;

    public Diagnostic(String element, String message, Level level) {
        this.element = Objects.requireNonNull(element, "null element");
        this.message = Objects.requireNonNull(message, "null message");
        this.level = Objects.requireNonNull(level, "null level");
    }

    /**
     * {@return the name of the element being compiled when the problem
     * got detected}
     */
    public String element() {
        return element;
    }

    public String message() {
        return message;
    }

    /**
     * {@return {@code WARNING} for dropped elements and unresolved
     * references, {@code FINE} for ignored attribute tokens}
     */
    public Level level() {
        return level;
    }

    @Override
    public String toString() {
        return "<" + element + ">: " + message;
    }

}
