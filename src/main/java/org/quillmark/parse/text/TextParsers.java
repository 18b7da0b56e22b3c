package org.quillmark.parse.text;

import org.quillmark.parse.Parsed;
import org.quillmark.parse.Parser;

/**
 * Factories for the character-level parsers shared by all grammars.
 */
public final class TextParsers {

    /** Horizontal whitespace, possibly empty. */
    public static final Characters WS = anyOf(' ', '\t');

    /** Whitespace including line breaks, possibly empty. */
    public static final Characters WS_OR_NL = anyOf(' ', '\t', '\n', '\r');

    private TextParsers() {}

    /**
     * A run of the given characters.
     */
    public static Characters anyOf(char... chars) {
        return new Characters(c -> contains(chars, c), 0, Characters.UNBOUNDED);
    }

    /**
     * A run of any characters except the given ones.
     */
    public static Characters anyBut(char... chars) {
        return new Characters(c -> !contains(chars, c), 0, Characters.UNBOUNDED);
    }

    /**
     * A run of characters within the given inclusive range.
     */
    public static Characters anyIn(char from, char to) {
        return new Characters(c -> c >= from && c <= to, 0, Characters.UNBOUNDED);
    }

    public static Characters anyWhile(Characters.CharPredicate predicate) {
        return new Characters(predicate, 0, Characters.UNBOUNDED);
    }

    /**
     * Exactly one character of any kind.
     */
    public static Characters anyChar() {
        return new Characters(c -> true, 0, Characters.UNBOUNDED).take(1);
    }

    /**
     * The given character.
     */
    public static Parser<String> ch(char expected) {
        return in -> {
            if (!in.atEnd() && in.charAt(0) == expected) {
                return new Parsed.Success<>(String.valueOf(expected), in.consume(1));
            }
            return new Parsed.Failure<>("Expected '" + expected + "'", in);
        };
    }

    /**
     * The given string.
     */
    public static Parser<String> literal(String expected) {
        return in -> {
            if (in.input().startsWith(expected, in.offset())) {
                return new Parsed.Success<>(expected, in.consume(expected.length()));
            }
            return new Parsed.Failure<>("Expected '" + expected + "'", in);
        };
    }

    public static DelimitedText<String> delimitedBy(char... chars) {
        return new DelimitedText<>(TextDelimiter.of(chars));
    }

    public static DelimitedText<String> delimitedBy(String endString) {
        return new DelimitedText<>(TextDelimiter.of(endString));
    }

    public static DelimitedText<String> delimitedBy(TextDelimiter delimiter) {
        return new DelimitedText<>(delimiter);
    }

    /**
     * All remaining text of the input.
     */
    public static DelimitedText<String> untilEnd() {
        return new DelimitedText<>(TextDelimiter.atEndOfInput());
    }

    /**
     * The rest of the current line, consuming the line break if present.
     */
    public static Parser<String> restOfLine() {
        return delimitedBy(TextDelimiter.of('\n').acceptEOF());
    }

    /**
     * A line containing only whitespace, including its line break.
     */
    public static Parser<String> blankLine() {
        return WS.keepLeft(ch('\n').orElse(Parser.eof().as("")));
    }

    /**
     * A reference name: letters and digits, with single occurrences of
     * {@code - _ . : +} between them.
     */
    public static Parser<String> refName() {
        Parser<String> alphaNum = anyWhile(c -> Character.isLetterOrDigit(c)).min(1);
        Parser<String> symbol = anyOf('-', '_', '.', ':', '+').take(1);
        return alphaNum.then(symbol.then(alphaNum).map(p -> p.first() + p.second()).rep())
                .map(p -> p.first() + String.join("", p.second()));
    }

    private static boolean contains(char[] chars, char c) {
        for (char candidate : chars) {
            if (candidate == c) return true;
        }
        return false;
    }
}
