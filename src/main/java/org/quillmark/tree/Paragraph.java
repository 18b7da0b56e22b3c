package org.quillmark.tree;

import java.util.List;

/**
 * A paragraph of inline content.
 *
 * @param content The nested elements.
 */
public record Paragraph(List<Span> content) implements Block {

    public Paragraph {
        content = List.copyOf(content);
    }

    @Override
    public List<Span> children() {
        return content;
    }

    @Override
    public Paragraph withChildren(List<? extends Element> newChildren) {
        return new Paragraph(Element.narrow(newChildren, Span.class));
    }
}
