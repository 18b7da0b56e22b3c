package org.quillmark.tree;

import java.util.List;

/**
 * Spans carrying a named style.
 *
 * @param style The style name.
 * @param content The nested spans.
 */
public record StyledSpan(String style, List<Span> content) implements Span {

    public StyledSpan {
        content = List.copyOf(content);
    }

    @Override
    public List<Span> children() {
        return content;
    }

    @Override
    public StyledSpan withChildren(List<? extends Element> newChildren) {
        return new StyledSpan(style, Element.narrow(newChildren, Span.class));
    }
}
