package org.quillmark.tree;

import java.util.List;

/**
 * The base interface for all nodes of a document tree.
 */
public interface Element {

    /**
     * Returns the direct child elements. This allows a generic walker to traverse the
     * tree without knowing the structure of each node.
     *
     * @return The child elements, or an empty list for leaf nodes.
     */
    default List<? extends Element> children() {
        return List.of();
    }

    /**
     * Creates a copy of this element with the given children.
     *
     * @param newChildren The replacement children, in the same order and of the same kind.
     * @return A new element, or this element if it has no children.
     */
    default Element withChildren(List<? extends Element> newChildren) {
        return this;
    }

    /**
     * Narrows a list of children to the given element kind.
     * @throws IllegalArgumentException if a child is of a different kind.
     */
    static <E extends Element> List<E> narrow(List<? extends Element> elements, Class<E> kind) {
        for (Element element : elements) {
            if (!kind.isInstance(element)) {
                throw new IllegalArgumentException("Expected " + kind.getSimpleName() + " but got " + element.getClass().getSimpleName());
            }
        }
        return elements.stream().map(kind::cast).toList();
    }
}
