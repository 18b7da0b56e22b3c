package org.quillmark.tree;

import java.util.List;

/**
 * The root of the content of a single document.
 *
 * @param content The nested elements.
 */
public record RootElement(List<Block> content) implements Element {

    public RootElement {
        content = List.copyOf(content);
    }

    @Override
    public List<Block> children() {
        return content;
    }

    @Override
    public RootElement withChildren(List<? extends Element> newChildren) {
        return new RootElement(Element.narrow(newChildren, Block.class));
    }
}
