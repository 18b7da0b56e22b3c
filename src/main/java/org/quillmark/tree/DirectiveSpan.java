package org.quillmark.tree;

import org.quillmark.rewrite.DocumentCursor;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * The deferred result of a span directive that needs access to the assembled tree.
 * It can be resolved exactly once.
 */
public final class DirectiveSpan implements SpanResolver {

    private final Function<DocumentCursor, Span> resolver;
    private final Span fallback;
    private final AtomicBoolean resolved = new AtomicBoolean();

    /**
     * @param resolver The function computing the final span.
     * @param fallback The literal source of the directive.
     */
    public DirectiveSpan(Function<DocumentCursor, Span> resolver, Span fallback) {
        this.resolver = resolver;
        this.fallback = fallback;
    }

    @Override
    public Span resolve(DocumentCursor cursor) {
        if (!resolved.compareAndSet(false, true)) {
            throw new IllegalStateException("Directive placeholder has already been resolved");
        }
        return resolver.apply(cursor);
    }

    @Override
    public Span fallback() {
        return fallback;
    }

    @Override
    public String toString() {
        return "DirectiveSpan[fallback=" + fallback + "]";
    }
}
