/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.scene;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.github.stanio.svgscene.geom.Transform;

public final class Group extends SceneNode {

    private final List<SceneNode> contents;

    public Group(List<? extends SceneNode> contents) {
        this(contents, Transform.IDENTITY, 1.0, Collections.emptyList());
    }

    public Group(List<? extends SceneNode> contents, Transform place,
                 double opacity, List<String> tags) {
        super(place, opacity, tags);
        this.contents = Collections.unmodifiableList(new ArrayList<>(contents));
    }

    /**
     * Copies the properties of {@code source} with the given contents.
     */
    Group(Group source, List<SceneNode> contents) {
        super(source);
        this.contents = Collections.unmodifiableList(new ArrayList<>(contents));
    }

    public List<SceneNode> contents() {
        return contents;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitGroup(this);
    }

    @Override
    public String toString() {
        return "Group(" + baseToString() + ", contents: " + contents + ")";
    }

}
