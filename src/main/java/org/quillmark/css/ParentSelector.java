package org.quillmark.css;

/**
 * The selector for the ancestor of an element.
 *
 * @param selector The selector the ancestor must match.
 * @param immediate {@code true} for the direct parent ({@code >}), {@code false} for any ancestor.
 */
public record ParentSelector(Selector selector, boolean immediate) {}
