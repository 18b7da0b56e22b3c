package org.quillmark.tree;

/**
 * Instructs a span builder to retract the last {@code length} characters of the
 * text it holds and to put {@code target} in their place. If there is not enough
 * text to retract, {@code fallback} is used instead and the text is kept.
 * <p>
 * This lets a span parser recognize a construct whose start was already emitted
 * as plain text without rewinding the input.
 *
 * @param length The number of characters to retract.
 * @param target The replacement for the retracted characters.
 * @param fallback The span to use when retraction is not possible.
 */
public record Reverse(int length, Span target, Span fallback) implements Span {}
