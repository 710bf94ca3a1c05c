/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.geom;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;

/**
 * Immutable 2&times;3 affine matrix.
 * <pre>
 * <code>x' = m11 * x + m21 * y + dx
 * y' = m12 * x + m22 * y + dy</code></pre>
 * <p>
 * Every composing operation post-multiplies the receiver, so that chained
 * calls apply in the order they are written, like the SVG {@code transform}
 * attribute: {@code move(10, 0).rotate(a)} rotates around the translated
 * origin.</p>
 */
public final class Transform {

    public static final Transform IDENTITY = new Transform(1, 0, 0, 1, 0, 0);

    private final double m11;
    private final double m12;
    private final double m21;
    private final double m22;
    private final double dx;
    private final double dy;

    public Transform(double m11, double m12,
                     double m21, double m22,
                     double dx, double dy) {
        this.m11 = m11;
        this.m12 = m12;
        this.m21 = m21;
        this.m22 = m22;
        this.dx = dx;
        this.dy = dy;
    }

    public static Transform identity() {
        return IDENTITY;
    }

    public static Transform translation(double dx, double dy) {
        return new Transform(1, 0, 0, 1, dx, dy);
    }

    public static Transform scaling(double sx, double sy) {
        return new Transform(sx, 0, 0, sy, 0, 0);
    }

    /**
     * @param   angle  rotation angle in radians
     */
    public static Transform rotation(double angle) {
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);
        return new Transform(cos, sin, -sin, cos, 0, 0);
    }

    public static Transform shearing(double shx, double shy) {
        return new Transform(1, shy, shx, 1, 0, 0);
    }

    public double m11() { return m11; }
    public double m12() { return m12; }
    public double m21() { return m21; }
    public double m22() { return m22; }
    public double dx() { return dx; }
    public double dy() { return dy; }

    public Transform move(double x, double y) {
        return concat(translation(x, y));
    }

    public Transform scale(double sx, double sy) {
        return concat(scaling(sx, sy));
    }

    public Transform rotate(double angle) {
        return concat(rotation(angle));
    }

    public Transform rotate(double angle, double cx, double cy) {
        return move(cx, cy).rotate(angle).move(-cx, -cy);
    }

    public Transform shear(double shx, double shy) {
        return concat(shearing(shx, shy));
    }

    /**
     * {@return {@code this} &times; {@code other}} &ndash; {@code other} gets
     * applied to a point first.
     */
    public Transform concat(Transform other) {
        return new Transform(m11 * other.m11 + m21 * other.m12,
                             m12 * other.m11 + m22 * other.m12,
                             m11 * other.m21 + m21 * other.m22,
                             m12 * other.m21 + m22 * other.m22,
                             m11 * other.dx + m21 * other.dy + dx,
                             m12 * other.dx + m22 * other.dy + dy);
    }

    public Point2D apply(double x, double y) {
        return new Point2D.Double(m11 * x + m21 * y + dx,
                                  m12 * x + m22 * y + dy);
    }

    public boolean isIdentity() {
        return equals(IDENTITY);
    }

    public AffineTransform toAffineTransform() {
        return new AffineTransform(m11, m12, m21, m22, dx, dy);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        if (!(obj instanceof Transform))
            return false;

        Transform other = (Transform) obj;
        return Double.compare(m11, other.m11) == 0
                && Double.compare(m12, other.m12) == 0
                && Double.compare(m21, other.m21) == 0
                && Double.compare(m22, other.m22) == 0
                && Double.compare(dx, other.dx) == 0
                && Double.compare(dy, other.dy) == 0;
    }

    @Override
    public int hashCode() {
        int hash = Double.hashCode(m11);
        hash = 31 * hash + Double.hashCode(m12);
        hash = 31 * hash + Double.hashCode(m21);
        hash = 31 * hash + Double.hashCode(m22);
        hash = 31 * hash + Double.hashCode(dx);
        return 31 * hash + Double.hashCode(dy);
    }

    @Override
    public String toString() {
        return "Transform(" + m11 + ", " + m12 + ", "
                + m21 + ", " + m22 + ", " + dx + ", " + dy + ")";
    }

}
