package org.quillmark.tree;

import java.util.List;

/**
 * A plain sequence of spans without additional semantics.
 *
 * @param content The nested spans.
 */
public record SpanSequence(List<Span> content) implements Span {

    public SpanSequence {
        content = List.copyOf(content);
    }

    @Override
    public List<Span> children() {
        return content;
    }

    @Override
    public SpanSequence withChildren(List<? extends Element> newChildren) {
        return new SpanSequence(Element.narrow(newChildren, Span.class));
    }
}
