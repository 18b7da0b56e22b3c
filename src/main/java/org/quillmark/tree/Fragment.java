package org.quillmark.tree;

import java.util.List;

/**
 * Named content that is not part of the main flow of the document.
 *
 * @param name The name of the fragment.
 * @param content The nested elements.
 */
public record Fragment(String name, List<Block> content) implements Block {

    public Fragment {
        content = List.copyOf(content);
    }

    @Override
    public List<Block> children() {
        return content;
    }

    @Override
    public Fragment withChildren(List<? extends Element> newChildren) {
        return new Fragment(name, Element.narrow(newChildren, Block.class));
    }
}
