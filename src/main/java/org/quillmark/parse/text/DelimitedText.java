package org.quillmark.parse.text;

import org.quillmark.parse.Parsed;
import org.quillmark.parse.Parser;
import org.quillmark.parse.ParserContext;

/**
 * Scans literal text until its {@link Delimiter} completes the scan.
 * Characters that cannot start a delimiter are skipped through a lookup table
 * built once per instance, so the cost per character is a single array access.
 *
 * @param <T> The type of the result produced by the delimiter.
 */
public class DelimitedText<T> implements Parser<T> {

    private final Delimiter<T> delimiter;
    private final boolean[] lookup;

    /**
     * Creates a scanner for the given delimiter.
     * @param delimiter The end condition of the scan.
     */
    public DelimitedText(Delimiter<T> delimiter) {
        this.delimiter = delimiter;
        int maxChar = delimiter.startChars().stream().mapToInt(c -> c).max().orElse(-1);
        this.lookup = new boolean[maxChar + 1];
        for (char c : delimiter.startChars()) {
            lookup[c] = true;
        }
    }

    /**
     * @return The end condition of this scanner.
     */
    public Delimiter<T> delimiter() {
        return delimiter;
    }

    @Override
    public Parsed<T> parse(ParserContext ctx) {
        String source = ctx.input();
        int end = source.length();
        int offset = ctx.offset();
        while (true) {
            int charsConsumed = offset - ctx.offset();
            if (offset == end) {
                return delimiter.atEOF(charsConsumed, ctx);
            }
            char c = source.charAt(offset);
            if (c < lookup.length && lookup[c]) {
                DelimiterResult<T> result = delimiter.atStartChar(c, charsConsumed, ctx);
                if (result instanceof DelimiterResult.Complete<T> complete) {
                    return complete.result();
                }
            }
            offset++;
        }
    }
}
