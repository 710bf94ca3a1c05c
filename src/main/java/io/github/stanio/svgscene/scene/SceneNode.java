/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.scene;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.github.stanio.svgscene.geom.Locus;
import io.github.stanio.svgscene.geom.Transform;

/**
 * Scene graph node.  The variants are {@link Group}, {@link Shape},
 * {@link Text}, and {@link Image}; the set is closed and consumers dispatch
 * on it using a {@link Visitor}.
 * <p>
 * The tree structure (group contents) and tags are fixed at construction.
 * Placement, opacity, visibility, and clip remain settable so a scene may be
 * adjusted after it has been built, f.e. by an animation driver.</p>
 */
public abstract class SceneNode {

    public interface Visitor<R> {
        R visitGroup(Group group);
        R visitShape(Shape shape);
        R visitText(Text text);
        R visitImage(Image image);
    }

    private Transform place;
    private double opacity;
    private boolean opaque;
    private boolean visible;
    private Locus clip;
    private final List<String> tags;

    SceneNode(Transform place, double opacity, List<String> tags) {
        this.place = Objects.requireNonNull(place, "null place");
        this.opacity = validOpacity(opacity);
        this.opaque = true;
        this.visible = true;
        this.tags = Collections.unmodifiableList(new ArrayList<>(tags));
    }

    /**
     * Copies the common properties of {@code source}.
     */
    SceneNode(SceneNode source) {
        this.place = source.place;
        this.opacity = source.opacity;
        this.opaque = source.opaque;
        this.visible = source.visible;
        this.clip = source.clip;
        this.tags = source.tags;
    }

    private static double validOpacity(double opacity) {
        if (!(opacity >= 0 && opacity <= 1)) {
            throw new IllegalArgumentException("opacity out of [0, 1]: " + opacity);
        }
        return opacity;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public Transform place() {
        return place;
    }

    public void setPlace(Transform place) {
        this.place = Objects.requireNonNull(place, "null place");
    }

    public double opacity() {
        return opacity;
    }

    public void setOpacity(double opacity) {
        this.opacity = validOpacity(opacity);
    }

    public boolean opaque() {
        return opaque;
    }

    public void setOpaque(boolean opaque) {
        this.opaque = opaque;
    }

    public boolean visible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    public Optional<Locus> clip() {
        return Optional.ofNullable(clip);
    }

    public void setClip(Locus clip) {
        this.clip = clip;
    }

    public List<String> tags() {
        return tags;
    }

    String baseToString() {
        return "place: " + place
                + (opacity != 1 ? ", opacity: " + opacity : "")
                + (visible ? "" : ", hidden")
                + (clip == null ? "" : ", clip: " + clip)
                + (tags.isEmpty() ? "" : ", tags: " + tags);
    }

}
