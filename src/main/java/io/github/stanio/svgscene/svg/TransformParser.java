/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import java.util.Arrays;

import io.github.stanio.svgscene.geom.Transform;

/**
 * Interprets transform lists like {@code "translate(10 5) rotate(45)"}.
 * <p>
 * Each {@code name(args)} call gets post-multiplied onto the accumulated
 * transform, in the order written.  Unknown names and calls with an
 * unsupported number of arguments are skipped.  A call without numeric
 * arguments ends the list.</p>
 */
final class TransformParser {

    private final Diagnostics diagnostics;

    TransformParser(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    static Transform parse(String list) {
        return new TransformParser(Diagnostics.logOnly()).parse(list, "transform");
    }

    /**
     * @param   list  the transform list text, may be {@code null}
     * @param   element  the name of the element being compiled, for
     *          diagnostics
     * @return  the composed transform; identity if {@code list} is
     *          {@code null}, blank, or has no valid calls
     */
    Transform parse(String list, String element) {
        Transform transform = Transform.IDENTITY;
        if (list == null)
            return transform;

        int length = list.length();
        int position = 0;
        while (position < length) {
            int nameStart = position;
            while (nameStart < length && !Character.isLetter(list.charAt(nameStart))) {
                nameStart++;
            }
            int nameEnd = nameStart;
            while (nameEnd < length && Character.isLetter(list.charAt(nameEnd))) {
                nameEnd++;
            }
            if (nameEnd == nameStart)
                break;

            int open = nameEnd;
            while (open < length && Character.isWhitespace(list.charAt(open))) {
                open++;
            }
            if (open >= length || list.charAt(open) != '(') {
                position = nameEnd;
                continue;
            }
            int close = list.indexOf(')', open + 1);
            if (close < 0)
                break;

            String name = list.substring(nameStart, nameEnd);
            double[] args = NumberScanner.numbers(list, open + 1, close);
            if (args.length == 0) {
                diagnostics.fine(element, "{0}() without arguments ends the transform list", name);
                break;
            }
            transform = apply(transform, name, args, element);
            position = close + 1;
        }
        return transform;
    }

    private Transform apply(Transform transform, String name,
                            double[] args, String element) {
        switch (name) {
        case "translate":
            return transform.move(args[0], args.length > 1 ? args[1] : 0);

        case "scale":
            return transform.scale(args[0], args.length > 1 ? args[1] : args[0]);

        case "rotate":
            if (args.length == 1) {
                return transform.rotate(Math.toRadians(args[0]));
            } else if (args.length == 3) {
                return transform.rotate(Math.toRadians(args[0]), args[1], args[2]);
            }
            break;

        case "skewX":
            return transform.shear(args[0], 0);

        case "skewY":
            return transform.shear(0, args[0]);

        case "matrix":
            if (args.length == 6) {
                return transform.concat(new Transform(args[0], args[1],
                                                      args[2], args[3],
                                                      args[4], args[5]));
            }
            break;

        default:
            diagnostics.fine(element, "Unknown transform: {0}", name);
            return transform;
        }
        diagnostics.fine(element, "Ignoring {0}{1}", name, Arrays.toString(args));
        return transform;
    }

}
