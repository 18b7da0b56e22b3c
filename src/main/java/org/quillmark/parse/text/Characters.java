package org.quillmark.parse.text;

import org.quillmark.parse.Parsed;
import org.quillmark.parse.Parser;
import org.quillmark.parse.ParserContext;

/**
 * Consumes a run of characters matching a predicate, with optional bounds
 * on the length of the run.
 */
public final class Characters implements Parser<String> {

    /**
     * A predicate on a single character.
     */
    @FunctionalInterface
    public interface CharPredicate {
        boolean test(char c);
    }

    static final int UNBOUNDED = Integer.MAX_VALUE;

    private final CharPredicate predicate;
    private final int min;
    private final int max;

    Characters(CharPredicate predicate, int min, int max) {
        this.predicate = predicate;
        this.min = min;
        this.max = max;
    }

    /**
     * Requires at least the given number of characters.
     */
    public Characters min(int count) {
        return new Characters(predicate, count, max);
    }

    /**
     * Consumes at most the given number of characters.
     */
    public Characters max(int count) {
        return new Characters(predicate, min, count);
    }

    /**
     * Consumes exactly the given number of characters.
     */
    public Characters take(int count) {
        return new Characters(predicate, count, count);
    }

    @Override
    public Parsed<String> parse(ParserContext in) {
        String source = in.input();
        int end = max == UNBOUNDED ? source.length() : Math.min(source.length(), in.offset() + max);
        int offset = in.offset();
        while (offset < end && predicate.test(source.charAt(offset))) {
            offset++;
        }
        int count = offset - in.offset();
        if (count < min) {
            return new Parsed.Failure<>("Expected at least " + min + " matching characters, found " + count, in.consume(count));
        }
        return new Parsed.Success<>(in.capture(count), in.consume(count));
    }
}
