package org.quillmark.tree;

/**
 * Plain text.
 *
 * @param content The text.
 */
public record Text(String content) implements Span {}
