package org.quillmark.tree;

import org.quillmark.rewrite.DocumentCursor;

/**
 * A span placeholder whose final content can only be computed once the whole
 * document tree has been assembled. The rewrite pass replaces it with the result
 * of {@link #resolve(DocumentCursor)}.
 */
public interface SpanResolver extends Span {

    /**
     * @param cursor The position of the containing document in the assembled tree.
     * @return The span replacing this placeholder.
     */
    Span resolve(DocumentCursor cursor);

    /**
     * @return The span representing the original source, used when resolution fails.
     */
    Span fallback();
}
