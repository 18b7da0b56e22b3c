package org.quillmark.parse.text;

import org.quillmark.parse.Parsed;
import org.quillmark.parse.ParserContext;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The end condition for plain text: a set of end characters or a multi-character
 * end string, plus options controlling empty results, the end of input and
 * characters that are not allowed in the text.
 * <p>
 * Instances are immutable; every option returns a modified copy.
 */
public final class TextDelimiter implements Delimiter<String> {

    /**
     * An additional condition checked after an end character was found.
     */
    @FunctionalInterface
    public interface PostCondition {
        /**
         * @param endChar The end character that was found.
         * @param charsConsumed The number of characters before the end character.
         * @param context The context at the start of the scan.
         * @return The number of characters the delimiter occupies, or a negative value
         *         if the delimiter does not match at this position.
         */
        int delimiterLength(char endChar, int charsConsumed, ParserContext context);
    }

    private final Set<Character> endChars;
    private final String endString;
    private final PostCondition postCondition;
    private final boolean acceptEOF;
    private final boolean nonEmpty;
    private final boolean keepDelimiter;
    private final Set<Character> failOn;
    private final Set<Character> startChars;

    private TextDelimiter(Set<Character> endChars, String endString, PostCondition postCondition,
                          boolean acceptEOF, boolean nonEmpty, boolean keepDelimiter, Set<Character> failOn) {
        this.endChars = Set.copyOf(endChars);
        this.endString = endString;
        this.postCondition = postCondition;
        this.acceptEOF = acceptEOF;
        this.nonEmpty = nonEmpty;
        this.keepDelimiter = keepDelimiter;
        this.failOn = Set.copyOf(failOn);
        Set<Character> start = new LinkedHashSet<>(endChars);
        start.addAll(failOn);
        this.startChars = Set.copyOf(start);
    }

    /**
     * Text that ends at the first of the given characters.
     */
    public static TextDelimiter of(char... chars) {
        Set<Character> set = new HashSet<>();
        for (char c : chars) set.add(c);
        return new TextDelimiter(set, null, null, false, false, false, Set.of());
    }

    /**
     * Text that ends at the first occurrence of the given string.
     */
    public static TextDelimiter of(String endString) {
        if (endString.isEmpty()) throw new IllegalArgumentException("End string must not be empty");
        if (endString.length() == 1) return of(endString.charAt(0));
        return new TextDelimiter(Set.of(endString.charAt(0)), endString, null, false, false, false, Set.of());
    }

    /**
     * Text that only ends at the end of the input.
     */
    public static TextDelimiter atEndOfInput() {
        return new TextDelimiter(Set.of(), null, null, true, false, false, Set.of());
    }

    public TextDelimiter acceptEOF() {
        return new TextDelimiter(endChars, endString, postCondition, true, nonEmpty, keepDelimiter, failOn);
    }

    public TextDelimiter nonEmpty() {
        return new TextDelimiter(endChars, endString, postCondition, acceptEOF, true, keepDelimiter, failOn);
    }

    /**
     * Leaves the delimiter itself unconsumed.
     */
    public TextDelimiter keepDelimiter() {
        return new TextDelimiter(endChars, endString, postCondition, acceptEOF, nonEmpty, true, failOn);
    }

    /**
     * Fails the scan when one of the given characters occurs before the delimiter.
     */
    public TextDelimiter failOn(char... chars) {
        Set<Character> set = new HashSet<>(failOn);
        for (char c : chars) set.add(c);
        return new TextDelimiter(endChars, endString, postCondition, acceptEOF, nonEmpty, keepDelimiter, set);
    }

    public TextDelimiter withPostCondition(PostCondition condition) {
        return new TextDelimiter(endChars, endString, condition, acceptEOF, nonEmpty, keepDelimiter, failOn);
    }

    @Override
    public Set<Character> startChars() {
        return startChars;
    }

    @Override
    public DelimiterResult<String> atStartChar(char startChar, int charsConsumed, ParserContext context) {
        if (failOn.contains(startChar)) {
            return DelimiterResult.complete(new Parsed.Failure<>("Unexpected character '" + startChar + "'", context.consume(charsConsumed)));
        }
        int delimLength = delimiterLength(startChar, charsConsumed, context);
        if (delimLength < 0) {
            return DelimiterResult.proceed();
        }
        if (charsConsumed == 0 && nonEmpty) {
            return DelimiterResult.complete(new Parsed.Failure<>("Expected at least 1 character before delimiter", context));
        }
        int consumed = keepDelimiter ? charsConsumed : charsConsumed + delimLength;
        return DelimiterResult.complete(new Parsed.Success<>(context.capture(charsConsumed), context.consume(consumed)));
    }

    private int delimiterLength(char startChar, int charsConsumed, ParserContext context) {
        int length = 1;
        if (endString != null) {
            length = context.input().startsWith(endString, context.offset() + charsConsumed) ? endString.length() : -1;
        }
        if (length >= 0 && postCondition != null) {
            int post = postCondition.delimiterLength(startChar, charsConsumed, context);
            length = post < 0 ? -1 : Math.max(length, post);
        }
        return length;
    }

    @Override
    public Parsed<String> atEOF(int charsConsumed, ParserContext context) {
        if (!acceptEOF) {
            return new Parsed.Failure<>("Expected delimiter not found", context);
        }
        if (charsConsumed == 0 && nonEmpty) {
            return new Parsed.Failure<>("Expected at least 1 character before end of input", context);
        }
        return new Parsed.Success<>(context.capture(charsConsumed), context.consume(charsConsumed));
    }
}
