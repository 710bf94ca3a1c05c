/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import io.github.stanio.svgscene.paint.Fill;
import io.github.stanio.svgscene.scene.SceneNode;
import io.github.stanio.svgscene.scene.Shape;

/**
 * Definitions collected from {@code defs} elements of a single document.
 * Nodes, fills and masks are kept in separate tables, so the same id may
 * name one of each.  A later definition replaces an earlier one with the
 * same id in the same table.
 */
final class DefinitionRegistry {

    private final Map<String, SceneNode> nodes = new HashMap<>();
    private final Map<String, Integer> nodeDepths = new HashMap<>();
    private final Map<String, Fill> fills = new HashMap<>();
    private final Map<String, Shape> masks = new HashMap<>();

    void putNode(String id, SceneNode node) {
        putNode(id, node, 0);
    }

    /**
     * @param   depth  the deepest {@code use} reference chain the node
     *          has been built from
     */
    void putNode(String id, SceneNode node, int depth) {
        nodes.put(id, node);
        nodeDepths.put(id, depth);
    }

    void putFill(String id, Fill fill) {
        fills.put(id, fill);
    }

    void putMask(String id, Shape mask) {
        masks.put(id, mask);
    }

    Optional<SceneNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    int nodeDepth(String id) {
        return nodeDepths.getOrDefault(id, 0);
    }

    Optional<Fill> fill(String id) {
        return Optional.ofNullable(fills.get(id));
    }

    Optional<Shape> mask(String id) {
        return Optional.ofNullable(masks.get(id));
    }

}
