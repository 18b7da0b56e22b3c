package org.quillmark.parse.markup;

/**
 * Accumulates the result of an inline parse. Some inline parsers produce a list of
 * spans while others only produce text, but they handle nested constructs the same
 * way; the builder is the only part that differs.
 * <p>
 * A builder is owned by a single parse call and is not thread-safe.
 *
 * @param <E> The type of a single element.
 * @param <R> The type of the final result.
 */
public interface ResultBuilder<E, R> {

    /**
     * Converts literal text to an element.
     */
    E fromString(String text);

    /**
     * Adds the next element in input order.
     */
    void append(E item);

    /**
     * @return The accumulated result.
     */
    R result();
}
