/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestInstance.Lifecycle;

@TestInstance(Lifecycle.PER_CLASS)
public class NumberScannerTest {

    @Test
    void signAndSecondPointSplit() {
        assertThat(NumberScanner.numbers("10-20.5.3 10"))
                .as("10-20.5.3 10")
                .containsExactly(10, -20.5, 0.3, 10);
    }

    @Test
    void separators() {
        assertThat(NumberScanner.numbers(" 1,2 , 3\t4\n5 "))
                .as("mixed separators")
                .containsExactly(1, 2, 3, 4, 5);
    }

    @Test
    void exponent() {
        assertThat(NumberScanner.numbers("1e-3,1E+2 2e1"))
                .as("1e-3,1E+2 2e1")
                .containsExactly(0.001, 100, 20);
    }

    @Test
    void exponentWithoutDigits() {
        assertThat(NumberScanner.numbers("3em 5e"))
                .as("3em 5e")
                .containsExactly(3, 5);
    }

    @Test
    void leadingPoint() {
        assertThat(NumberScanner.numbers("+.5-.5 1."))
                .as("+.5-.5 1.")
                .containsExactly(0.5, -0.5, 1);
    }

    @Test
    void noNumbers() {
        assertThat(NumberScanner.numbers("abc - . +")).as("abc - . +").isEmpty();
        assertThat(NumberScanner.numbers("")).as("empty").isEmpty();
    }

    @Test
    void range() {
        assertThat(NumberScanner.numbers("a(1 2) b(3)", 2, 5))
                .as("range")
                .containsExactly(1, 2);
    }

    @Test
    void cursor() {
        NumberScanner scanner = new NumberScanner("7 8");

        assertThat(scanner.hasNext()).as("hasNext()").isTrue();
        assertThat(scanner.next()).as("first").isEqualTo(7);
        assertThat(scanner.next()).as("second").isEqualTo(8);
        assertThat(scanner.hasNext()).as("hasNext() at end").isFalse();
    }

}
