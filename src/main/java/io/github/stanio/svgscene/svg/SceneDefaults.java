/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import com.google.gson.Gson;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;

import io.github.stanio.svgscene.paint.Color;

/**
 * Values applied where the document doesn't specify its own.
 * <p>
 * Can be loaded from a JSON file with any subset of the properties:</p>
 * <pre>
 * <code>{
 *   "fill": "#000000",
 *   "strokeWidth": 1,
 *   "fontName": "Serif",
 *   "fontSize": 12,
 *   "textMeasure": "approximate",
 *   "maxReferenceDepth": 32
 * }</code></pre>
 */
public final class SceneDefaults {

    private static final SceneDefaults STANDARD =
            new SceneDefaults(Color.BLACK, 1, "Serif", 12, "approximate", 32);

    private final Color fill;
    private final double strokeWidth;
    private final String fontName;
    private final double fontSize;
    private final String textMeasure;
    private final int maxReferenceDepth;

    private SceneDefaults(Color fill, double strokeWidth,
                          String fontName, double fontSize,
                          String textMeasure, int maxReferenceDepth) {
        this.fill = Objects.requireNonNull(fill, "null fill");
        if (!(strokeWidth >= 0)) {
            throw new IllegalArgumentException("Invalid stroke width: " + strokeWidth);
        }
        this.strokeWidth = strokeWidth;
        this.fontName = Objects.requireNonNull(fontName, "null fontName");
        if (!(fontSize > 0)) {
            throw new IllegalArgumentException("Invalid font size: " + fontSize);
        }
        this.fontSize = fontSize;
        TextMeasure.forName(textMeasure);
        this.textMeasure = textMeasure;
        if (maxReferenceDepth < 1) {
            throw new IllegalArgumentException("Invalid max reference depth: "
                                               + maxReferenceDepth);
        }
        this.maxReferenceDepth = maxReferenceDepth;
    }

    public static SceneDefaults standard() {
        return STANDARD;
    }

    /**
     * Loads defaults from a JSON file.  Properties missing from the file
     * keep their {@link #standard() standard} values.
     *
     * @param   file  the JSON file to load
     * @return  the loaded defaults
     * @throws  IOException  if I/O error occurs
     * @throws  JsonParseException  if the file content is not valid
     */
    public static SceneDefaults load(Path file)
            throws IOException, JsonParseException {
        SourceConfig source;
        try (InputStream fin = Files.newInputStream(file);
                Reader text = new InputStreamReader(fin, StandardCharsets.UTF_8)) {
            source = new Gson().fromJson(text, SourceConfig.class);
        } catch (JsonIOException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw e;
        }

        if (source == null) {
            return STANDARD;
        }
        try {
            return source.toDefaults();
        } catch (RuntimeException e) {
            throw new JsonParseException(e.getMessage(), e);
        }
    }

    public Color fill() {
        return fill;
    }

    public double strokeWidth() {
        return strokeWidth;
    }

    public String fontName() {
        return fontName;
    }

    public double fontSize() {
        return fontSize;
    }

    /**
     * {@return the name of the text measure: {@code approximate} or
     * {@code awt}}
     *
     * @see  TextMeasure#forName(String)
     */
    public String textMeasure() {
        return textMeasure;
    }

    /**
     * {@return the maximum nesting of {@code use} references}
     */
    public int maxReferenceDepth() {
        return maxReferenceDepth;
    }

    public SceneDefaults withFill(Color fill) {
        return new SceneDefaults(fill, strokeWidth, fontName,
                fontSize, textMeasure, maxReferenceDepth);
    }

    public SceneDefaults withStrokeWidth(double strokeWidth) {
        return new SceneDefaults(fill, strokeWidth, fontName,
                fontSize, textMeasure, maxReferenceDepth);
    }

    public SceneDefaults withFont(String fontName, double fontSize) {
        return new SceneDefaults(fill, strokeWidth, fontName,
                fontSize, textMeasure, maxReferenceDepth);
    }

    public SceneDefaults withTextMeasure(String textMeasure) {
        return new SceneDefaults(fill, strokeWidth, fontName,
                fontSize, textMeasure, maxReferenceDepth);
    }

    public SceneDefaults withMaxReferenceDepth(int maxReferenceDepth) {
        return new SceneDefaults(fill, strokeWidth, fontName,
                fontSize, textMeasure, maxReferenceDepth);
    }

    @Override
    public String toString() {
        return "SceneDefaults(fill: " + fill
                + ", strokeWidth: " + strokeWidth
                + ", font: " + fontName + " " + fontSize
                + ", textMeasure: " + textMeasure
                + ", maxReferenceDepth: " + maxReferenceDepth + ")";
    }


    /**
     * The JSON file content.
     */
    static class SourceConfig {

        String fill;
        Double strokeWidth;
        String fontName;
        Double fontSize;
        String textMeasure;
        Integer maxReferenceDepth;

        SceneDefaults toDefaults() {
            SceneDefaults defaults = STANDARD;
            Color color = defaults.fill;
            if (fill != null) {
                color = Color.decode(fill, 1.0).orElseThrow(() ->
                        new IllegalArgumentException("Invalid fill color: " + fill));
            }
            return new SceneDefaults(color,
                    (strokeWidth == null) ? defaults.strokeWidth : strokeWidth,
                    (fontName == null) ? defaults.fontName : fontName,
                    (fontSize == null) ? defaults.fontSize : fontSize,
                    (textMeasure == null) ? defaults.textMeasure : textMeasure,
                    (maxReferenceDepth == null) ? defaults.maxReferenceDepth
                                                : maxReferenceDepth);
        }

    }


}
