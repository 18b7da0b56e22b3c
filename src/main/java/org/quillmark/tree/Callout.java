package org.quillmark.tree;

import java.util.List;

/**
 * A highlighted box of blocks, such as a warning or a note.
 *
 * @param type The kind of callout, for example {@code info} or {@code warn}.
 * @param content The nested elements.
 */
public record Callout(String type, List<Block> content) implements Block {

    public Callout {
        content = List.copyOf(content);
    }

    @Override
    public List<Block> children() {
        return content;
    }

    @Override
    public Callout withChildren(List<? extends Element> newChildren) {
        return new Callout(type, Element.narrow(newChildren, Block.class));
    }
}
