package org.quillmark.parse.markup;

/**
 * The outcome of a single scan of the inline dispatch engine.
 */
public sealed interface InlineResult permits InlineResult.EndDelimiter, InlineResult.NestedDelimiter {

    /**
     * @return The literal text scanned before the delimiter.
     */
    String text();

    /**
     * The end of the inline element was reached.
     * @param text The literal text before the end delimiter.
     */
    record EndDelimiter(String text) implements InlineResult {}

    /**
     * The start character of a nested element was reached.
     * @param startChar The trigger character.
     * @param text The literal text before the trigger character.
     */
    record NestedDelimiter(char startChar, String text) implements InlineResult {}
}
