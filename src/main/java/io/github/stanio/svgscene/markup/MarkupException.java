/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.markup;

import java.io.IOException;

/**
 * Signals malformed markup vs. an error reading it (device error).
 */
public class MarkupException extends IOException {

    private static final long serialVersionUID = 4117360386291154732L;

    public MarkupException(String message) {
        super(message);
    }

    public MarkupException(String message, Throwable cause) {
        super(message, cause);
    }

}
