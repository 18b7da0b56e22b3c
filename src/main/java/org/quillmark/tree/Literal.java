package org.quillmark.tree;

/**
 * Text that is reproduced verbatim, without any further markup interpretation.
 *
 * @param content The literal text.
 */
public record Literal(String content) implements Span {}
