/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import java.text.MessageFormat;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reports local compile problems to the log and an optional listener.
 */
final class Diagnostics {

    private static final Logger log = Logger.getLogger(SVGParser.class.getName());

    private static final Diagnostics LOG_ONLY = new Diagnostics(null);

    private final Consumer<? super Diagnostic> listener;

    Diagnostics(Consumer<? super Diagnostic> listener) {
        this.listener = listener;
    }

    static Diagnostics logOnly() {
        return LOG_ONLY;
    }

    void warning(String element, String pattern, Object... args) {
        report(Level.WARNING, element, pattern, args);
    }

    void fine(String element, String pattern, Object... args) {
        report(Level.FINE, element, pattern, args);
    }

    private void report(Level level, String element,
                        String pattern, Object... args) {
        if (listener == null && !log.isLoggable(level))
            return;

        String message = MessageFormat.format(pattern, args);
        log.log(level, "<{0}>: {1}", new Object[] { element, message });
        if (listener != null) {
            listener.accept(new Diagnostic(element, message, level));
        }
    }

}
