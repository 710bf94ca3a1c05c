/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.markup;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of a markup element, independent of the XML API that
 * produced it.
 */
public interface MarkupElement {

    /**
     * {@return the element name without namespace prefix}
     */
    String name();

    /**
     * {@return the value of the named attribute}  Attribute names are
     * matched literally, prefix included: {@code "xlink:href"}.
     *
     * @param   name  the qualified attribute name
     */
    Optional<String> attribute(String name);

    /**
     * {@return all attributes, in no particular order}
     */
    Map<String, String> attributes();

    /**
     * {@return the child elements in document order}
     */
    List<MarkupElement> children();

    /**
     * {@return the child text and element nodes in document order}
     * Adjacent text nodes are reported merged.
     */
    List<MarkupContent> content();

    /**
     * {@return the concatenation of the immediate text children, or empty
     * if there's none}
     */
    Optional<String> text();

}
