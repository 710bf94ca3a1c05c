/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.geom;

/**
 * Path command kinds.  Upper-case constants take absolute coordinates,
 * lower-case ones &ndash; coordinates relative to the current point.
 * {@link #Z} closes the current sub-path regardless of the letter case
 * used in the source.
 */
public enum PathSegmentType {

    M(2, true), m(2, false),
    L(2, true), l(2, false),
    H(1, true), h(1, false),
    V(1, true), v(1, false),
    C(6, true), c(6, false),
    S(4, true), s(4, false),
    Z(0, true);

    private final int arity;
    private final boolean absolute;

    private PathSegmentType(int arity, boolean absolute) {
        this.arity = arity;
        this.absolute = absolute;
    }

    /**
     * {@return the exact number of operands a segment of this kind carries}
     */
    public int arity() {
        return arity;
    }

    public boolean isAbsolute() {
        return absolute;
    }

    /**
     * {@return the command implied when operands repeat past the first
     * group} &ndash; {@code lineTo} following a {@code moveTo}, otherwise
     * the same command.
     */
    public PathSegmentType repeated() {
        switch (this) {
        case M:
            return L;
        case m:
            return l;
        default:
            return this;
        }
    }

    /**
     * @param   letter  a path command letter
     * @return  the matching type, or {@code null} if {@code letter} isn't
     *          a supported command
     */
    public static PathSegmentType forLetter(char letter) {
        switch (letter) {
        case 'M': return M;
        case 'm': return m;
        case 'L': return L;
        case 'l': return l;
        case 'H': return H;
        case 'h': return h;
        case 'V': return V;
        case 'v': return v;
        case 'C': return C;
        case 'c': return c;
        case 'S': return S;
        case 's': return s;
        case 'Z':
        case 'z': return Z;
        default:
            return null;
        }
    }

}
