package org.quillmark.tree;

/**
 * A block of verbatim text.
 *
 * @param content The literal text.
 */
public record LiteralBlock(String content) implements Block {}
