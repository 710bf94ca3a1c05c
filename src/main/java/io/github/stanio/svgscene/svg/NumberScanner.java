/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Forward-scanning cursor over the numbers in a character range.
 * <p>
 * Numbers may be separated by whitespace, commas, or nothing at all
 * where a sign or a second decimal point starts the next one:
 * {@code "10-20.5.3"} yields {@code 10, -20.5, 0.3}.  An exponent is
 * recognized only when digits follow the {@code e}/{@code E} (and its
 * optional sign).  Any other character is skipped.</p>
 */
final class NumberScanner {

    private final CharSequence text;
    private final int end;
    private int position;

    private double next;
    private boolean hasNext;

    NumberScanner(CharSequence text) {
        this(text, 0, text.length());
    }

    NumberScanner(CharSequence text, int start, int end) {
        this.text = text;
        this.position = start;
        this.end = end;
    }

    /**
     * {@return all numbers in the given text}
     */
    static double[] numbers(CharSequence text) {
        return new NumberScanner(text).remaining();
    }

    static double[] numbers(CharSequence text, int start, int end) {
        return new NumberScanner(text, start, end).remaining();
    }

    boolean hasNext() {
        if (!hasNext) {
            hasNext = scan();
        }
        return hasNext;
    }

    double next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        hasNext = false;
        return next;
    }

    double[] remaining() {
        double[] buf = new double[8];
        int count = 0;
        while (hasNext()) {
            if (count == buf.length) {
                buf = Arrays.copyOf(buf, count * 2);
            }
            buf[count++] = next();
        }
        return Arrays.copyOf(buf, count);
    }

    private boolean scan() {
        while (position < end) {
            int start = position;
            int index = start;
            char ch = text.charAt(index);
            if (ch == '+' || ch == '-') {
                index++;
            }
            int intDigits = skipDigits(index);
            index += intDigits;
            int fracDigits = 0;
            if (index < end && text.charAt(index) == '.') {
                fracDigits = skipDigits(index + 1);
                index += 1 + fracDigits;
            }
            if (intDigits + fracDigits == 0) {
                position = start + 1;
                continue;
            }
            index = exponent(index);
            next = Double.parseDouble(text.subSequence(start, index).toString());
            position = index;
            return true;
        }
        return false;
    }

    private int skipDigits(int index) {
        int count = 0;
        while (index + count < end && isDigit(text.charAt(index + count))) {
            count++;
        }
        return count;
    }

    private int exponent(int index) {
        if (index >= end) return index;

        char ch = text.charAt(index);
        if (ch != 'e' && ch != 'E') return index;

        int digitsStart = index + 1;
        if (digitsStart < end) {
            char sign = text.charAt(digitsStart);
            if (sign == '+' || sign == '-') {
                digitsStart++;
            }
        }
        int digits = skipDigits(digitsStart);
        return (digits == 0) ? index : digitsStart + digits;
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

}
