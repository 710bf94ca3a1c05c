/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.paint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.github.stanio.svgscene.geom.Transform;

/**
 * Common gradient properties: the color ramp, the coordinate system
 * (user space vs. object bounding box), and the gradient transform.
 * <p>
 * A gradient has at least two stops.  A ramp with a single stop is
 * represented as that stop's {@code Color} instead.</p>
 */
public abstract class Gradient extends Fill {

    private final List<Stop> stops;
    private final boolean userSpace;
    private final Transform transform;

    Gradient(List<Stop> stops, boolean userSpace, Transform transform) {
        if (stops.size() < 2) {
            throw new IllegalArgumentException("At least two stops required: " + stops);
        }
        this.stops = Collections.unmodifiableList(new ArrayList<>(stops));
        this.userSpace = userSpace;
        this.transform = Objects.requireNonNull(transform, "null transform");
    }

    public List<Stop> stops() {
        return stops;
    }

    /**
     * {@return {@code true} if the geometry is in user space coordinates,
     * {@code false} if it is relative to the bounding box of the painted
     * object}
     */
    public boolean userSpace() {
        return userSpace;
    }

    public Transform transform() {
        return transform;
    }

    boolean baseEquals(Gradient other) {
        return userSpace == other.userSpace
                && stops.equals(other.stops)
                && transform.equals(other.transform);
    }

    int baseHashCode() {
        return Objects.hash(stops, userSpace, transform);
    }

}
