/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.scene;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.github.stanio.svgscene.geom.Transform;

/**
 * Reference to external raster content.  The source is not loaded or
 * decoded; {@code w} and {@code h} are the requested size, {@code 0} if
 * unspecified (use the intrinsic size).
 */
public final class Image extends SceneNode {

    private final String src;
    private final Align xAlign;
    private final Align yAlign;
    private final AspectRatio aspectRatio;
    private final double w;
    private final double h;

    public Image(String src, double w, double h) {
        this(src, Align.MIN, Align.MIN, AspectRatio.NONE, w, h,
             Transform.IDENTITY, 1.0, Collections.emptyList());
    }

    public Image(String src, Align xAlign, Align yAlign,
                 AspectRatio aspectRatio, double w, double h,
                 Transform place, double opacity, List<String> tags) {
        super(place, opacity, tags);
        this.src = Objects.requireNonNull(src, "null src");
        this.xAlign = Objects.requireNonNull(xAlign, "null xAlign");
        this.yAlign = Objects.requireNonNull(yAlign, "null yAlign");
        this.aspectRatio = Objects.requireNonNull(aspectRatio, "null aspectRatio");
        this.w = w;
        this.h = h;
    }

    Image(Image source) {
        super(source);
        this.src = source.src;
        this.xAlign = source.xAlign;
        this.yAlign = source.yAlign;
        this.aspectRatio = source.aspectRatio;
        this.w = source.w;
        this.h = source.h;
    }

    public String src() { return src; }
    public Align xAlign() { return xAlign; }
    public Align yAlign() { return yAlign; }
    public AspectRatio aspectRatio() { return aspectRatio; }
    public double w() { return w; }
    public double h() { return h; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitImage(this);
    }

    @Override
    public String toString() {
        return "Image(" + src + ", w: " + w + ", h: " + h
                + ", " + baseToString() + ")";
    }

}
