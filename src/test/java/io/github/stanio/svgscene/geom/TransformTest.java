/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.geom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestInstance.Lifecycle;

@TestInstance(Lifecycle.PER_CLASS)
public class TransformTest {

    private static final double EPSILON = 1e-9;

    @Test
    void rotateAroundCenterKeepsCenter() {
        Transform transform = Transform.IDENTITY
                .rotate(Math.toRadians(37), 15, -4);

        Point2D center = transform.apply(15, -4);

        assertThat(center.getX()).as("x").isCloseTo(15, within(EPSILON));
        assertThat(center.getY()).as("y").isCloseTo(-4, within(EPSILON));
    }

    @Test
    void rotateAroundCenterMovesOtherPoints() {
        Transform transform = Transform.IDENTITY
                .rotate(Math.toRadians(90), 10, 10);

        Point2D point = transform.apply(20, 10);

        assertThat(point.getX()).as("x").isCloseTo(10, within(EPSILON));
        assertThat(point.getY()).as("y").isCloseTo(20, within(EPSILON));
    }

    @Test
    void operationsApplyInWrittenOrder() {
        Transform transform = Transform.IDENTITY.move(10, 0).scale(2, 3);

        Point2D point = transform.apply(1, 1);

        assertThat(point).as("move(10, 0).scale(2, 3) of (1, 1)")
                         .isEqualTo(new Point2D.Double(12, 3));
    }

    @Test
    void concatMatchesAffineTransform() {
        Transform transform = Transform.translation(5, -2)
                .concat(new Transform(1, 2, 3, 4, 5, 6))
                .shear(0.5, 0);

        AffineTransform expected = AffineTransform.getTranslateInstance(5, -2);
        expected.concatenate(new AffineTransform(1, 2, 3, 4, 5, 6));
        expected.concatenate(AffineTransform.getShearInstance(0.5, 0));

        Point2D actual = transform.apply(7, 11);
        Point2D reference = expected.transform(new Point2D.Double(7, 11), null);
        assertThat(actual.getX()).as("x").isCloseTo(reference.getX(), within(EPSILON));
        assertThat(actual.getY()).as("y").isCloseTo(reference.getY(), within(EPSILON));

        Point2D handOff = transform.toAffineTransform()
                                   .transform(new Point2D.Double(7, 11), null);
        assertThat(handOff.getX()).as("toAffineTransform() x")
                                  .isCloseTo(reference.getX(), within(EPSILON));
        assertThat(handOff.getY()).as("toAffineTransform() y")
                                  .isCloseTo(reference.getY(), within(EPSILON));
    }

    @Test
    void identity() {
        assertThat(Transform.identity().isIdentity()).as("identity().isIdentity()")
                                                      .isTrue();
        assertThat(Transform.IDENTITY.move(0, 0)).as("move(0, 0)")
                                                 .isEqualTo(Transform.IDENTITY);
        assertThat(Transform.scaling(2, 2).isIdentity()).as("scaling(2, 2).isIdentity()")
                                                         .isFalse();
    }

}
