/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.scene;

import java.util.ArrayList;
import java.util.List;

/**
 * Scene tree utilities.
 */
public final class SceneNodes {

    private static final SceneNode.Visitor<SceneNode> deepCopy = new DeepCopy();

    private SceneNodes() {/* no instances */}

    /**
     * Creates a structurally independent copy of the given node and all its
     * descendants.  Changing any settable property of the copy, or of any
     * node in it, doesn't affect the source tree.  Only immutable values
     * (geometry, paint, font) are shared.
     *
     * @param   <T>  the node type
     * @param   node  the root of the tree to copy
     * @return  the copy
     */
    @SuppressWarnings("unchecked")
    public static <T extends SceneNode> T deepCopy(T node) {
        return (T) node.accept(deepCopy);
    }

    /**
     * {@return the number of nodes in the given tree, including its root}
     */
    public static int count(SceneNode node) {
        return node.accept(new SceneNode.Visitor<Integer>() {
            @Override public Integer visitGroup(Group group) {
                int count = 1;
                for (SceneNode child : group.contents()) {
                    count += child.accept(this);
                }
                return count;
            }
            @Override public Integer visitShape(Shape shape) { return 1; }
            @Override public Integer visitText(Text text) { return 1; }
            @Override public Integer visitImage(Image image) { return 1; }
        });
    }


    private static class DeepCopy implements SceneNode.Visitor<SceneNode> {

        @Override
        public SceneNode visitGroup(Group group) {
            List<SceneNode> contents = new ArrayList<>(group.contents().size());
            for (SceneNode child : group.contents()) {
                contents.add(child.accept(this));
            }
            return new Group(group, contents);
        }

        @Override
        public SceneNode visitShape(Shape shape) {
            return new Shape(shape);
        }

        @Override
        public SceneNode visitText(Text text) {
            return new Text(text);
        }

        @Override
        public SceneNode visitImage(Image image) {
            return new Image(image);
        }

    } // class DeepCopy


} // class SceneNodes
