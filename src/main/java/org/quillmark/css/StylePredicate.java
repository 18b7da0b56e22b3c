package org.quillmark.css;

/**
 * A single condition of a selector.
 */
public sealed interface StylePredicate permits StylePredicate.ElementType, StylePredicate.Id, StylePredicate.StyleName {

    /**
     * Matches elements by the simple name of their type, e.g. {@code Paragraph}.
     */
    record ElementType(String name) implements StylePredicate {}

    /**
     * Matches the element with the given id, written {@code #id}.
     */
    record Id(String id) implements StylePredicate {}

    /**
     * Matches elements carrying the given style, written {@code .name}.
     */
    record StyleName(String name) implements StylePredicate {}
}
