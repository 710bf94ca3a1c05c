/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import io.github.stanio.svgscene.geom.Path;
import io.github.stanio.svgscene.geom.PathSegment;
import io.github.stanio.svgscene.geom.PathSegmentType;

/**
 * Interprets path data ({@code d} attribute values).
 * <p>
 * Operands past the first group of a command repeat it implicitly
 * ({@code moveto} repeats as {@code lineto}).  A command with fewer
 * operands than it needs, a trailing partial group, and the operands of
 * unsupported commands (arcs, quadratic curves) are dropped.</p>
 */
final class PathParser {

    private final Diagnostics diagnostics;

    PathParser(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    static Path parse(String data) {
        return new PathParser(Diagnostics.logOnly()).parse(data, "path");
    }

    Path parse(String data, String element) {
        List<PathSegment> segments = new ArrayList<>();
        int length = data.length();
        int commandIndex = nextCommand(data, 0);
        if (commandIndex > 0 && NumberScanner.numbers(data, 0, commandIndex).length > 0) {
            diagnostics.fine(element, "Operands before the first command skipped: {0}",
                             data.substring(0, commandIndex).strip());
        }
        while (commandIndex < length) {
            char letter = data.charAt(commandIndex);
            int operandsEnd = nextCommand(data, commandIndex + 1);
            double[] operands = NumberScanner.numbers(data, commandIndex + 1, operandsEnd);
            PathSegmentType type = PathSegmentType.forLetter(letter);
            if (type == null) {
                diagnostics.fine(element, "Unsupported path command {0} skipped", letter);
            } else {
                addSegments(segments, type, letter, operands, element);
            }
            commandIndex = operandsEnd;
        }
        return new Path(segments);
    }

    private void addSegments(List<PathSegment> segments,
                             PathSegmentType type, char letter,
                             double[] operands, String element) {
        int arity = type.arity();
        if (arity == 0) {
            if (operands.length > 0) {
                diagnostics.fine(element, "Operands after {0} skipped: {1}",
                                 letter, Arrays.toString(operands));
            }
            segments.add(new PathSegment(type));
            return;
        }

        if (operands.length < arity) {
            diagnostics.fine(element, "Dropping {0} segment with {1} of {2} operands",
                             letter, operands.length, arity);
            return;
        }

        int groups = operands.length / arity;
        for (int i = 0; i < groups; i++) {
            segments.add(new PathSegment(i == 0 ? type : type.repeated(),
                    Arrays.copyOfRange(operands, i * arity, (i + 1) * arity)));
        }
        if (operands.length % arity != 0) {
            diagnostics.fine(element, "Dropping {0} trailing {1} operands",
                             operands.length % arity, letter);
        }
    }

    /**
     * Command letters are all letters except the exponent marker.
     */
    private static int nextCommand(String data, int from) {
        int index = from;
        int length = data.length();
        while (index < length) {
            char ch = data.charAt(index);
            if (Character.isLetter(ch) && ch != 'e' && ch != 'E')
                break;
            index++;
        }
        return index;
    }

}
