package org.quillmark.tree;

import java.util.List;

/**
 * Text with emphasis.
 *
 * @param content The nested spans.
 */
public record Emphasized(List<Span> content) implements Span {

    public Emphasized {
        content = List.copyOf(content);
    }

    @Override
    public List<Span> children() {
        return content;
    }

    @Override
    public Emphasized withChildren(List<? extends Element> newChildren) {
        return new Emphasized(Element.narrow(newChildren, Span.class));
    }
}
