package org.quillmark.tree;

import java.util.List;

/**
 * A sequence of blocks without additional semantics.
 *
 * @param content The nested elements.
 */
public record BlockSequence(List<Block> content) implements Block {

    public BlockSequence {
        content = List.copyOf(content);
    }

    @Override
    public List<Block> children() {
        return content;
    }

    @Override
    public BlockSequence withChildren(List<? extends Element> newChildren) {
        return new BlockSequence(Element.narrow(newChildren, Block.class));
    }
}
