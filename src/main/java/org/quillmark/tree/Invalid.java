package org.quillmark.tree;

/**
 * An element that could not be processed. It carries the reason and a fallback that
 * represents the original source.
 */
public interface Invalid extends Element {

    SystemMessage message();

    Element fallback();
}
