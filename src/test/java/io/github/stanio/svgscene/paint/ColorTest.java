/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.paint;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestInstance.Lifecycle;

@TestInstance(Lifecycle.PER_CLASS)
public class ColorTest {

    @Test
    void decodeLongHex() {
        assertThat(Color.decode("#ff8000", 1.0))
                .as("decode(#ff8000)")
                .hasValueSatisfying(color -> assertThat(color)
                        .extracting(Color::r, Color::g, Color::b, Color::a)
                        .containsExactly(255, 128, 0, 255));
    }

    @Test
    void decodeShortHex() {
        assertThat(Color.decode("#f80", 1.0)).as("decode(#f80)")
                                             .contains(Color.rgb(0xFF8800));
    }

    @Test
    void decodeWithoutHash() {
        assertThat(Color.decode("00ff00", 1.0)).as("decode(00ff00)")
                                               .contains(Color.rgb(0, 255, 0));
    }

    @Test
    void decodeNamedIgnoresCase() {
        assertThat(Color.decode("CornflowerBlue", 1.0))
                .as("decode(CornflowerBlue)")
                .contains(Color.rgb(0x6495ED));
    }

    @Test
    void decodeNamedWithOpacity() {
        assertThat(Color.decode("red", 0.5))
                .as("decode(red, 0.5)")
                .hasValueSatisfying(color -> assertThat(color)
                        .extracting(Color::r, Color::g, Color::b, Color::a)
                        .containsExactly(255, 0, 0, 128));
    }

    @Test
    void decodeRgbFunction() {
        assertThat(Color.decode("rgb(255, 128, 0)", 1.0))
                .as("decode(rgb(255, 128, 0))")
                .contains(Color.rgb(255, 128, 0));
        assertThat(Color.decode("RGB(100%,50%,0%)", 0.5))
                .as("decode(RGB(100%,50%,0%), 0.5)")
                .contains(Color.rgba(255, 128, 0, 0.5));
        assertThat(Color.decode("rgb(300, -5, 12.4)", 1.0))
                .as("decode(rgb(300, -5, 12.4))")
                .contains(Color.rgb(255, 0, 12));
        assertThat(Color.decode("rgb(1, 2)", 1.0)).as("decode(rgb(1, 2))").isEmpty();
        assertThat(Color.decode("rgb(a, b, c)", 1.0)).as("decode(rgb(a, b, c))").isEmpty();
    }

    @Test
    void decodeInvalid() {
        assertThat(Color.decode("#12", 1.0)).as("decode(#12)").isEmpty();
        assertThat(Color.decode("#gg0000", 1.0)).as("decode(#gg0000)").isEmpty();
        assertThat(Color.decode("reddish", 1.0)).as("decode(reddish)").isEmpty();
    }

    @Test
    void opacityClamped() {
        assertThat(Color.rgba(1, 2, 3, 1.5).a()).as("alpha of opacity 1.5")
                                                .isEqualTo(255);
        assertThat(Color.rgba(1, 2, 3, -1).a()).as("alpha of opacity -1")
                                               .isEqualTo(0);
    }

    @Test
    void withOpacityKeepsChannels() {
        Color color = Color.rgb(10, 20, 30).withOpacity(0);

        assertThat(color).extracting(Color::r, Color::g, Color::b, Color::opacity)
                         .as("Color(r, g, b, opacity)")
                         .containsExactly(10, 20, 30, 0.0);
    }

}
