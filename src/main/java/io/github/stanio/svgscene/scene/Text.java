/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.scene;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.github.stanio.svgscene.geom.Transform;
import io.github.stanio.svgscene.paint.Fill;
import io.github.stanio.svgscene.paint.Font;

public final class Text extends SceneNode {

    private final String text;
    private final Font font;
    private Fill fill;
    private final Align align;
    private final Baseline baseline;

    public Text(String text, Font font, Fill fill) {
        this(text, font, fill, Align.MIN, Baseline.TOP,
             Transform.IDENTITY, 1.0, Collections.emptyList());
    }

    public Text(String text, Font font, Fill fill,
                Align align, Baseline baseline,
                Transform place, double opacity, List<String> tags) {
        super(place, opacity, tags);
        this.text = Objects.requireNonNull(text, "null text");
        this.font = Objects.requireNonNull(font, "null font");
        this.fill = Objects.requireNonNull(fill, "null fill");
        this.align = Objects.requireNonNull(align, "null align");
        this.baseline = Objects.requireNonNull(baseline, "null baseline");
    }

    Text(Text source) {
        super(source);
        this.text = source.text;
        this.font = source.font;
        this.fill = source.fill;
        this.align = source.align;
        this.baseline = source.baseline;
    }

    public String text() {
        return text;
    }

    public Font font() {
        return font;
    }

    public Fill fill() {
        return fill;
    }

    public void setFill(Fill fill) {
        this.fill = Objects.requireNonNull(fill, "null fill");
    }

    public Align align() {
        return align;
    }

    public Baseline baseline() {
        return baseline;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitText(this);
    }

    @Override
    public String toString() {
        return "Text(\"" + text + "\", " + font + ", fill: " + fill
                + ", " + baseline + ", " + baseToString() + ")";
    }

}
