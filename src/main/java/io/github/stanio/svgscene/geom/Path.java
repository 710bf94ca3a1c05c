/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.geom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Path extends Locus {

    private final List<PathSegment> segments;

    public Path(List<PathSegment> segments) {
        this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
    }

    public List<PathSegment> segments() {
        return segments;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPath(this);
    }

    /**
     * Bounds of the end and control points.  The curves lie within the hull
     * of their control points, so the result may be larger than the tight
     * geometric bounds, never smaller.
     */
    @Override
    public Rect bounds() {
        double[] points = new double[segments.size() * 6];
        int count = 0;
        double x = 0, y = 0;
        double startX = 0, startY = 0;
        for (PathSegment segment : segments) {
            PathSegmentType type = segment.type();
            double baseX = type.isAbsolute() ? 0 : x;
            double baseY = type.isAbsolute() ? 0 : y;
            switch (type) {
            case H:
            case h:
                x = baseX + segment.data(0);
                break;

            case V:
            case v:
                y = baseY + segment.data(0);
                break;

            case Z:
                x = startX;
                y = startY;
                break;

            default:
                for (int i = 0, len = type.arity() - 2; i < len; i += 2) {
                    points[count++] = baseX + segment.data(i);
                    points[count++] = baseY + segment.data(i + 1);
                }
                x = baseX + segment.data(type.arity() - 2);
                y = baseY + segment.data(type.arity() - 1);
            }
            if (type == PathSegmentType.M || type == PathSegmentType.m) {
                startX = x;
                startY = y;
            }
            points[count++] = x;
            points[count++] = y;
        }
        return pointBounds(points, count);
    }

    static Rect pointBounds(double[] points, int length) {
        if (length < 2)
            return new Rect(0, 0, 0, 0);

        double minX = points[0], maxX = minX;
        double minY = points[1], maxY = minY;
        for (int i = 2; i < length; i += 2) {
            minX = Math.min(minX, points[i]);
            maxX = Math.max(maxX, points[i]);
            minY = Math.min(minY, points[i + 1]);
            maxY = Math.max(maxY, points[i + 1]);
        }
        return new Rect(minX, minY, maxX - minX, maxY - minY);
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this || (obj instanceof Path
                && segments.equals(((Path) obj).segments));
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return "Path" + segments;
    }

}
