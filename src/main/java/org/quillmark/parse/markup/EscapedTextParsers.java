package org.quillmark.parse.markup;

import org.quillmark.parse.Parser;
import org.quillmark.parse.text.DelimitedText;
import org.quillmark.parse.text.TextDelimiter;
import org.quillmark.parse.text.TextParsers;

import java.util.Map;

/**
 * Parsers for text that may contain characters escaped with a backslash.
 */
public interface EscapedTextParsers {

    /**
     * Parses the character following a backslash. Dialects may restrict the set of
     * characters that can be escaped.
     *
     * @return The parser for the escaped character, producing the unescaped text.
     */
    default Parser<String> escapedChar() {
        return TextParsers.anyChar();
    }

    /**
     * Adds support for escape sequences to the given text parser.
     */
    default Parser<String> escapedText(DelimitedText<String> text) {
        return InlineParsers.text(text, Map.of('\\', escapedChar()));
    }

    /**
     * Parses non-empty text up to the first unescaped occurrence of one of the given characters.
     * The delimiter is consumed but not included in the result.
     * <p>
     * Emptiness is checked on the unescaped result, as an escape sequence right
     * before the delimiter restarts the scan with no characters consumed.
     */
    default Parser<String> escapedUntil(char... chars) {
        return escapedText(TextParsers.delimitedBy(TextDelimiter.of(chars)))
                .filter(text -> !text.isEmpty(), "Expected at least 1 character before delimiter");
    }
}
