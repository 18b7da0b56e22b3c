package org.quillmark.tree;

/**
 * An inline element, part of a paragraph or another span container.
 */
public interface Span extends Element {}
