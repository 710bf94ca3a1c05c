/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestInstance.Lifecycle;

import io.github.stanio.svgscene.geom.Path;
import io.github.stanio.svgscene.geom.PathSegment;
import io.github.stanio.svgscene.geom.PathSegmentType;

@TestInstance(Lifecycle.PER_CLASS)
public class PathParserTest {

    private final List<Diagnostic> problems = new ArrayList<>();

    private final PathParser parser = new PathParser(new Diagnostics(problems::add));

    @BeforeEach
    void clearProblems() {
        problems.clear();
    }

    private List<PathSegment> parse(String data) {
        return parser.parse(data, "path").segments();
    }

    private static double[] allOperands(List<PathSegment> segments) {
        return segments.stream()
                       .flatMapToDouble(segment -> Arrays.stream(segment.data()))
                       .toArray();
    }

    @Test
    void operandsWithoutSeparators() {
        List<PathSegment> segments = parse("M10-20.5.3 10");

        assertThat(allOperands(segments)).as("operands")
                                         .containsExactly(10, -20.5, 0.3, 10);
        assertThat(segments).extracting(PathSegment::type)
                            .as("segment types")
                            .containsExactly(PathSegmentType.M, PathSegmentType.L);
    }

    @Test
    void shortCurveDropped() {
        List<PathSegment> segments = parse("M0 0 L1 1 L2 2 C1 2 3");

        assertThat(segments).extracting(PathSegment::type)
                            .as("segment types")
                            .containsExactly(PathSegmentType.M,
                                             PathSegmentType.L,
                                             PathSegmentType.L);
        assertThat(problems).extracting(Diagnostic::level)
                            .as("diagnostics")
                            .containsExactly(Level.FINE);
    }

    @Test
    void shortRelativeCurveDropped() {
        assertThat(parse("M0 0 c1 2 3 4 5")).extracting(PathSegment::type)
                                            .as("segment types")
                                            .containsExactly(PathSegmentType.M);
    }

    @Test
    void implicitRepeats() {
        List<PathSegment> segments = parse("m1 1 2 2 3 3");

        assertThat(segments).extracting(PathSegment::type)
                            .as("segment types")
                            .containsExactly(PathSegmentType.m,
                                             PathSegmentType.l,
                                             PathSegmentType.l);
        assertThat(segments.get(2).data()).as("last operands")
                                          .containsExactly(3, 3);
    }

    @Test
    void partialTrailingGroupDropped() {
        List<PathSegment> segments = parse("M0 0 L1 1 2 2 3");

        assertThat(allOperands(segments)).as("operands")
                                         .containsExactly(0, 0, 1, 1, 2, 2);
        assertThat(problems).as("problems").hasSize(1);
    }

    @Test
    void everySupportedCommand() {
        List<PathSegment> segments = parse("M0 0 h10 V5 H0 v-5 l1,1 L2,2"
                + " C1 1 2 2 3 3 c1 1 2 2 3 3 S1 1 2 2 s1 1 2 2 z");

        assertThat(segments).extracting(PathSegment::type)
                            .as("segment types")
                            .containsExactly(PathSegmentType.M, PathSegmentType.h,
                                    PathSegmentType.V, PathSegmentType.H,
                                    PathSegmentType.v, PathSegmentType.l,
                                    PathSegmentType.L, PathSegmentType.C,
                                    PathSegmentType.c, PathSegmentType.S,
                                    PathSegmentType.s, PathSegmentType.Z);
        assertThat(problems).as("problems").isEmpty();
    }

    @Test
    void arcSkipped() {
        List<PathSegment> segments = parse("M0 0 A 1 1 0 0 1 5 5 L 10 10");

        assertThat(segments).extracting(PathSegment::type)
                            .as("segment types")
                            .containsExactly(PathSegmentType.M, PathSegmentType.L);
        assertThat(segments.get(1).data()).as("lineto operands")
                                          .containsExactly(10, 10);
        assertThat(problems).as("problems").hasSize(1);
    }

    @Test
    void scientificNotation() {
        assertThat(allOperands(parse("M1e2 1E-1"))).as("operands")
                                                   .containsExactly(100, 0.1);
    }

    @Test
    void empty() {
        Path path = parser.parse("", "path");

        assertThat(path.segments()).as("segments").isEmpty();
    }

}
