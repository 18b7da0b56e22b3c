package org.quillmark.parse;

/**
 * The combined result of two parsers applied in sequence.
 *
 * @param first The result of the first parser.
 * @param second The result of the second parser.
 */
public record Pair<A, B>(A first, B second) {}
