package org.quillmark.parse;

/**
 * An immutable view of the input at a specific offset.
 * Every parser receives a context and returns the context it stopped at,
 * so backtracking is simply a matter of reusing an older instance.
 */
public final class ParserContext {

    private final String input;
    private final int offset;

    private ParserContext(String input, int offset) {
        this.input = input;
        this.offset = offset;
    }

    /**
     * Creates a context positioned at the start of the given input.
     * @param input The complete input string.
     * @return A new context at offset 0.
     */
    public static ParserContext of(String input) {
        return new ParserContext(input, 0);
    }

    /**
     * @return The complete input string, independent of the current offset.
     */
    public String input() {
        return input;
    }

    /**
     * @return The absolute offset of this context within the input.
     */
    public int offset() {
        return offset;
    }

    /**
     * @return The number of characters left to read.
     */
    public int remaining() {
        return input.length() - offset;
    }

    /**
     * @return true if no characters are left.
     */
    public boolean atEnd() {
        return offset >= input.length();
    }

    /**
     * Returns a character relative to the current offset.
     * A negative value reads characters that were already consumed.
     * @param relative The position relative to the current offset.
     * @return The character at that position.
     */
    public char charAt(int relative) {
        return input.charAt(offset + relative);
    }

    /**
     * Captures the given number of characters starting at the current offset.
     * The number is clamped to the remaining input.
     * @param numChars The number of characters to capture.
     * @return The captured text.
     */
    public String capture(int numChars) {
        int end = Math.min(input.length(), offset + Math.max(0, numChars));
        return input.substring(offset, end);
    }

    /**
     * Creates a new context advanced by the given number of characters.
     * @param numChars The number of characters to consume.
     * @return The advanced context, or this instance if nothing is consumed.
     */
    public ParserContext consume(int numChars) {
        if (numChars == 0) return this;
        return new ParserContext(input, offset + numChars);
    }

    /**
     * Computes the line and column of the current offset.
     * @return The position of this context.
     */
    public Position position() {
        return Position.of(input, offset);
    }

    @Override
    public String toString() {
        return "ParserContext" + position();
    }
}
