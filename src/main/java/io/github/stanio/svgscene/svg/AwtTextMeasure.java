/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import java.awt.font.FontRenderContext;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.github.stanio.svgscene.paint.Font;

class AwtTextMeasure implements TextMeasure {

    private final FontRenderContext renderContext =
            new FontRenderContext(null, true, true);

    private final Map<Font, java.awt.Font> fonts = new ConcurrentHashMap<>();

    @Override
    public double width(String text, Font font) {
        java.awt.Font awtFont = fonts.computeIfAbsent(font, k ->
                new java.awt.Font(k.name(), java.awt.Font.PLAIN, 1)
                        .deriveFont((float) k.size()));
        return awtFont.getStringBounds(text, renderContext).getWidth();
    }

}
