package org.quillmark.parse.markup;

import org.quillmark.parse.Parsed;
import org.quillmark.parse.ParserContext;
import org.quillmark.parse.text.Delimiter;
import org.quillmark.parse.text.DelimiterResult;

import java.util.HashSet;
import java.util.Set;

/**
 * Combines the end delimiter of an inline element with the trigger characters of
 * its nested elements. The end delimiter takes precedence when a character is both.
 */
public class InlineDelimiter implements Delimiter<InlineResult> {

    private final Set<Character> nestedDelimiters;
    private final Delimiter<String> endDelimiter;
    private final Set<Character> startChars;

    public InlineDelimiter(Set<Character> nestedDelimiters, Delimiter<String> endDelimiter) {
        this.nestedDelimiters = Set.copyOf(nestedDelimiters);
        this.endDelimiter = endDelimiter;
        Set<Character> all = new HashSet<>(nestedDelimiters);
        all.addAll(endDelimiter.startChars());
        this.startChars = Set.copyOf(all);
    }

    @Override
    public Set<Character> startChars() {
        return startChars;
    }

    @Override
    public DelimiterResult<InlineResult> atStartChar(char startChar, int charsConsumed, ParserContext context) {
        if (endDelimiter.startChars().contains(startChar)) {
            DelimiterResult<String> end = endDelimiter.atStartChar(startChar, charsConsumed, context);
            if (end instanceof DelimiterResult.Complete<String> complete) {
                return DelimiterResult.complete(complete.result().map(InlineResult.EndDelimiter::new));
            }
            if (!nestedDelimiters.contains(startChar)) {
                return DelimiterResult.proceed();
            }
        }
        String text = context.capture(charsConsumed);
        return DelimiterResult.complete(new Parsed.Success<>(new InlineResult.NestedDelimiter(startChar, text), context.consume(charsConsumed + 1)));
    }

    @Override
    public Parsed<InlineResult> atEOF(int charsConsumed, ParserContext context) {
        return endDelimiter.atEOF(charsConsumed, context).map(InlineResult.EndDelimiter::new);
    }
}
