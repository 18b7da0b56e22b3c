package org.quillmark.tree;

import org.quillmark.rewrite.DocumentCursor;

/**
 * A block placeholder whose final content can only be computed once the whole
 * document tree has been assembled.
 *
 * @see SpanResolver
 */
public interface BlockResolver extends Block {

    Block resolve(DocumentCursor cursor);

    Block fallback();
}
