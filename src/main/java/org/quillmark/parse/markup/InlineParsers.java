package org.quillmark.parse.markup;

import org.quillmark.parse.Parsed;
import org.quillmark.parse.Parser;
import org.quillmark.parse.ParserContext;
import org.quillmark.parse.text.DelimitedText;
import org.quillmark.tree.Span;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The generic inline parser shared by all markup dialects.
 * <p>
 * Instead of trying every span parser at every character, the text is scanned up to
 * the next trigger character, and only the parser registered for that character is
 * tried. If it fails, the trigger character is kept as literal text and scanning
 * resumes right after it.
 */
public final class InlineParsers {

    private InlineParsers() {}

    /**
     * Creates the generic inline parser.
     * <p>
     * The suppliers are evaluated once per parse call. The builder supplier must
     * return a fresh instance each time.
     *
     * @param text The parser for the text of the current element; its delimiter defines where the element ends.
     * @param nested A mapping from the start character of a nested element to its parser.
     * @param resultBuilder Creates the builder for the final result.
     * @param <E> The element type produced by the nested parsers.
     * @param <R> The result type.
     * @return The inline parser.
     */
    public static <E, R> Parser<R> inline(Supplier<? extends DelimitedText<String>> text,
                                          Supplier<? extends Map<Character, ? extends Parser<? extends E>>> nested,
                                          Supplier<? extends ResultBuilder<E, R>> resultBuilder) {
        return in -> {
            ResultBuilder<E, R> builder = resultBuilder.get();
            Map<Character, ? extends Parser<? extends E>> nestedMap = nested.get();
            DelimitedText<InlineResult> scanner =
                    new DelimitedText<>(new InlineDelimiter(nestedMap.keySet(), text.get().delimiter()));

            ParserContext current = in;
            while (true) {
                Parsed<InlineResult> scanned = scanner.parse(current);
                if (!(scanned instanceof Parsed.Success<InlineResult> success)) {
                    return ((Parsed.Failure<InlineResult>) scanned).cast();
                }
                addText(builder, success.result().text());
                if (success.result() instanceof InlineResult.NestedDelimiter nestedDelimiter) {
                    Parser<? extends E> parser = nestedMap.get(nestedDelimiter.startChar());
                    Parsed<E> nestedResult = Parsed.widen(parser.parse(success.next()));
                    if (nestedResult instanceof Parsed.Success<E> nestedSuccess) {
                        builder.append(nestedSuccess.result());
                        current = nestedSuccess.next();
                    } else {
                        builder.append(builder.fromString(String.valueOf(nestedDelimiter.startChar())));
                        current = success.next();
                    }
                } else {
                    return new Parsed.Success<>(builder.result(), success.next());
                }
            }
        };
    }

    /**
     * Parses a list of spans.
     *
     * @param text The parser for the text of the current element.
     * @param spanParsers A mapping from the start character of a span to its parser.
     * @return The parser producing the spans.
     */
    public static Parser<List<Span>> spans(DelimitedText<String> text, Map<Character, ? extends Parser<? extends Span>> spanParsers) {
        return InlineParsers.<Span, List<Span>>inline(() -> text, () -> spanParsers, SpanBuilder::new);
    }

    /**
     * Variant of {@link #spans(DelimitedText, Map)} with a lazily built parser mapping,
     * for grammars where span parsers refer to each other recursively.
     */
    public static Parser<List<Span>> spans(DelimitedText<String> text, Supplier<? extends Map<Character, ? extends Parser<? extends Span>>> spanParsers) {
        return InlineParsers.<Span, List<Span>>inline(() -> text, spanParsers, SpanBuilder::new);
    }

    /**
     * Parses text, giving nested parsers the chance to transform parts of it.
     *
     * @param text The parser for the text of the current element.
     * @param nested A mapping from the start character of a nested element to its parser.
     * @return The parser producing the text.
     */
    public static Parser<String> text(DelimitedText<String> text, Map<Character, ? extends Parser<String>> nested) {
        return InlineParsers.<String, String>inline(() -> text, () -> nested, TextBuilder::new);
    }

    private static <E> void addText(ResultBuilder<E, ?> builder, String text) {
        if (!text.isEmpty()) {
            builder.append(builder.fromString(text));
        }
    }
}
