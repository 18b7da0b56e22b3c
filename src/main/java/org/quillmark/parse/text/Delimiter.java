package org.quillmark.parse.text;

import org.quillmark.parse.Parsed;
import org.quillmark.parse.ParserContext;

import java.util.Set;

/**
 * The end condition of a {@link DelimitedText} scan. The scanner only consults the
 * delimiter at characters contained in {@link #startChars()} and at the end of the input.
 *
 * @param <T> The type of the result produced when the scan completes.
 */
public interface Delimiter<T> {

    /**
     * @return The characters that may start a delimiter.
     */
    Set<Character> startChars();

    /**
     * Invoked when the scanner hits one of the start characters.
     * @param startChar The character that was hit.
     * @param charsConsumed The number of characters scanned before the start character.
     * @param context The context at the start of the scan.
     * @return {@link DelimiterResult.Complete} to end the scan, or {@link DelimiterResult.Continue} to keep scanning.
     */
    DelimiterResult<T> atStartChar(char startChar, int charsConsumed, ParserContext context);

    /**
     * Invoked when the scanner reaches the end of the input.
     * @param charsConsumed The number of characters scanned.
     * @param context The context at the start of the scan.
     * @return The final outcome of the scan.
     */
    Parsed<T> atEOF(int charsConsumed, ParserContext context);
}
