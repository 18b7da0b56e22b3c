package org.quillmark.tree;

/**
 * A block-level element.
 */
public interface Block extends Element {}
