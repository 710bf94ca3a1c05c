/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestInstance.Lifecycle;

import io.github.stanio.svgscene.geom.Transform;

@TestInstance(Lifecycle.PER_CLASS)
public class TransformParserTest {

    private final List<Diagnostic> problems = new ArrayList<>();

    private final TransformParser parser =
            new TransformParser(new Diagnostics(problems::add));

    @BeforeEach
    void clearProblems() {
        problems.clear();
    }

    private Transform parse(String list) {
        return parser.parse(list, "g");
    }

    @Test
    void blank() {
        assertThat(parse(null)).as("null").isEqualTo(Transform.IDENTITY);
        assertThat(parse("  ")).as("blank").isEqualTo(Transform.IDENTITY);
    }

    @Test
    void translateDefaultY() {
        assertThat(parse("translate(10)")).as("translate(10)")
                                          .isEqualTo(Transform.translation(10, 0));
    }

    @Test
    void scaleDefaultY() {
        assertThat(parse("scale(3)")).as("scale(3)")
                                     .isEqualTo(Transform.scaling(3, 3));
    }

    @Test
    void composedInWrittenOrder() {
        assertThat(parse("translate(10,20) scale(2)"))
                .as("translate(10,20) scale(2)")
                .isEqualTo(Transform.IDENTITY.move(10, 20).scale(2, 2));
    }

    @Test
    void rotateAroundPoint() {
        Point2D center = parse("rotate(90, 10, 10)").apply(10, 10);

        assertThat(center.getX()).as("x").isCloseTo(10, within(1e-9));
        assertThat(center.getY()).as("y").isCloseTo(10, within(1e-9));
    }

    @Test
    void rotateDegrees() {
        Point2D point = parse("rotate(90)").apply(1, 0);

        assertThat(point.getX()).as("x").isCloseTo(0, within(1e-9));
        assertThat(point.getY()).as("y").isCloseTo(1, within(1e-9));
    }

    @Test
    void rotateWrongArgumentCount() {
        assertThat(parse("rotate(45 1) translate(5)"))
                .as("rotate(45 1) translate(5)")
                .isEqualTo(Transform.translation(5, 0));
        assertThat(problems).extracting(Diagnostic::level)
                            .as("diagnostic levels")
                            .containsExactly(Level.FINE);
    }

    @Test
    void matrix() {
        assertThat(parse("matrix(1,2,3,4,5,6)"))
                .as("matrix(1,2,3,4,5,6)")
                .isEqualTo(new Transform(1, 2, 3, 4, 5, 6));
    }

    @Test
    void matrixWrongArgumentCount() {
        assertThat(parse("matrix(1 2 3 4 5) scale(2)"))
                .as("matrix(1 2 3 4 5) scale(2)")
                .isEqualTo(Transform.scaling(2, 2));
        assertThat(problems).as("problems").hasSize(1);
    }

    @Test
    void skew() {
        assertThat(parse("skewX(0.5)")).as("skewX(0.5)")
                                       .isEqualTo(Transform.shearing(0.5, 0));
        assertThat(parse("skewY(0.25)")).as("skewY(0.25)")
                                        .isEqualTo(Transform.shearing(0, 0.25));
    }

    @Test
    void emptyArgumentsEndList() {
        assertThat(parse("translate(4) scale() translate(5)"))
                .as("translate(4) scale() translate(5)")
                .isEqualTo(Transform.translation(4, 0));
    }

    @Test
    void unknownNameSkipped() {
        assertThat(parse("foo(1) translate(3)"))
                .as("foo(1) translate(3)")
                .isEqualTo(Transform.translation(3, 0));
    }

    @Test
    void trailingGarbage() {
        assertThat(parse("translate(1) junk ("))
                .as("translate(1) junk (")
                .isEqualTo(Transform.translation(1, 0));
    }

    @Test
    void spaceBeforeParenthesis() {
        assertThat(parse("translate (2 3)"))
                .as("translate (2 3)")
                .isEqualTo(Transform.translation(2, 3));
    }

}
