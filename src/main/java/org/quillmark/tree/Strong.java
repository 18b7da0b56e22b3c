package org.quillmark.tree;

import java.util.List;

/**
 * Text with strong emphasis.
 *
 * @param content The nested spans.
 */
public record Strong(List<Span> content) implements Span {

    public Strong {
        content = List.copyOf(content);
    }

    @Override
    public List<Span> children() {
        return content;
    }

    @Override
    public Strong withChildren(List<? extends Element> newChildren) {
        return new Strong(Element.narrow(newChildren, Span.class));
    }
}
