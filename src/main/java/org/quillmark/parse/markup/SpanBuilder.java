package org.quillmark.parse.markup;

import org.quillmark.tree.Reverse;
import org.quillmark.tree.Span;
import org.quillmark.tree.Text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A {@link ResultBuilder} that produces a list of spans. It holds back the most
 * recent span as pending, so that adjacent text can be merged and a
 * {@link Reverse} can retract text that was already appended.
 * <p>
 * The result never contains two consecutive {@link Text} spans.
 */
public class SpanBuilder implements ResultBuilder<Span, List<Span>> {

    private final List<Span> buffer = new ArrayList<>();
    private Span pending;

    @Override
    public Span fromString(String text) {
        return new Text(text);
    }

    @Override
    public void append(Span item) {
        if (pending instanceof Text text && item instanceof Text next) {
            pending = new Text(text.content() + next.content());
        } else if (item instanceof Reverse reverse) {
            if (pending instanceof Text text && text.content().length() >= reverse.length()) {
                String remaining = text.content().substring(0, text.content().length() - reverse.length());
                if (!remaining.isEmpty()) flush(new Text(remaining));
                pending = reverse.target();
            } else {
                flush(pending);
                pending = reverse.fallback();
            }
        } else {
            flush(pending);
            pending = item;
        }
    }

    @Override
    public List<Span> result() {
        flush(pending);
        pending = null;
        return Collections.unmodifiableList(new ArrayList<>(buffer));
    }

    private void flush(Span span) {
        if (span == null) return;
        int last = buffer.size() - 1;
        if (last >= 0 && buffer.get(last) instanceof Text previous && span instanceof Text text) {
            buffer.set(last, new Text(previous.content() + text.content()));
        } else {
            buffer.add(span);
        }
    }
}
