package org.quillmark.tree;

import org.quillmark.rewrite.DocumentCursor;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * The deferred result of a block directive that needs access to the assembled tree.
 * It can be resolved exactly once.
 */
public final class DirectiveBlock implements BlockResolver {

    private final Function<DocumentCursor, Block> resolver;
    private final Block fallback;
    private final AtomicBoolean resolved = new AtomicBoolean();

    public DirectiveBlock(Function<DocumentCursor, Block> resolver, Block fallback) {
        this.resolver = resolver;
        this.fallback = fallback;
    }

    @Override
    public Block resolve(DocumentCursor cursor) {
        if (!resolved.compareAndSet(false, true)) {
            throw new IllegalStateException("Directive placeholder has already been resolved");
        }
        return resolver.apply(cursor);
    }

    @Override
    public Block fallback() {
        return fallback;
    }

    @Override
    public String toString() {
        return "DirectiveBlock[fallback=" + fallback + "]";
    }
}
