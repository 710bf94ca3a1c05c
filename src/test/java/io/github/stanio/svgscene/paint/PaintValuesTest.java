/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.paint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestInstance.Lifecycle;

@TestInstance(Lifecycle.PER_CLASS)
public class PaintValuesTest {

    @Test
    void strokeDefaults() {
        Stroke stroke = new Stroke(Color.BLACK);

        assertThat(stroke).extracting(Stroke::width, Stroke::cap, Stroke::join)
                          .as("Stroke(width, cap, join)")
                          .containsExactly(1.0, LineCap.SQUARE, LineJoin.MITER);
        assertThat(stroke.dashes()).as("dashes").isEmpty();
    }

    @Test
    void negativeStrokeWidth() {
        assertThatThrownBy(() -> new Stroke(Color.BLACK, -1, LineCap.BUTT, LineJoin.BEVEL))
                .as("new Stroke(width: -1)")
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void negativeDash() {
        assertThatThrownBy(() -> new Stroke(Color.BLACK, 1, LineCap.BUTT, LineJoin.BEVEL, 2, -2))
                .as("new Stroke(dashes: 2, -2)")
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stopOffsetOutOfRange() {
        assertThatThrownBy(() -> new Stop(1.5, Color.WHITE))
                .as("new Stop(1.5)")
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void gradientNeedsTwoStops() {
        List<Stop> oneStop = List.of(new Stop(0, Color.WHITE));
        assertThatThrownBy(() -> new LinearGradient(0, 0, 1, 0, false, oneStop))
                .as("new LinearGradient(1 stop)")
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void gradientEquality() {
        List<Stop> stops = List.of(new Stop(0, Color.WHITE), new Stop(1, Color.BLACK));

        assertThat(new RadialGradient(0.5, 0.5, 0.5, 0.5, 0.5, false, stops))
                .as("RadialGradient")
                .isEqualTo(new RadialGradient(0.5, 0.5, 0.5, 0.5, 0.5, false, stops))
                .isNotEqualTo(new RadialGradient(0.5, 0.5, 0.5, 0.5, 0.5, true, stops));
    }

}
