package org.quillmark.rewrite;

import org.quillmark.tree.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A generic class for traversing a document tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system, so
 * passes over the tree do not depend on the structure of each element.
 */
public class TreeWalker {

    private final Map<Class<? extends Element>, Consumer<Element>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from element classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends Element>, Consumer<Element>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks a list of elements.
     * @param elements The list of elements to walk.
     */
    public void walk(List<? extends Element> elements) {
        for (Element element : elements) {
            walk(element);
        }
    }

    /**
     * Walks a single element and its children recursively.
     * @param element The element to walk.
     */
    public void walk(Element element) {
        if (element == null) {
            return;
        }

        handlers.getOrDefault(element.getClass(), e -> {}).accept(element);

        for (Element child : element.children()) {
            walk(child);
        }
    }

    /**
     * Transforms a tree by replacing elements.
     * The children of a replaced element are not visited; the replacement function is
     * responsible for its own result.
     *
     * @param element The root element to transform.
     * @param replacement Returns the replacement for an element, or {@code null} to keep it.
     * @return The transformed element, or the same instance if nothing changed.
     */
    public Element transform(Element element, Function<Element, Element> replacement) {
        if (element == null) {
            return null;
        }

        Element replaced = replacement.apply(element);
        if (replaced != null) {
            return replaced;
        }

        List<? extends Element> children = element.children();
        List<Element> transformedChildren = new ArrayList<>(children.size());
        boolean childrenChanged = false;

        for (Element child : children) {
            Element transformedChild = transform(child, replacement);
            if (transformedChild != child) {
                childrenChanged = true;
            }
            transformedChildren.add(transformedChild);
        }

        return childrenChanged ? element.withChildren(transformedChildren) : element;
    }
}
