package org.quillmark.parse.markup;

import org.quillmark.directive.DirectiveRegistry;
import org.quillmark.directive.IBlockDirective;
import org.quillmark.directive.ISpanDirective;
import org.quillmark.directive.MarkupDirectiveParsers;
import org.quillmark.parse.Parsed;
import org.quillmark.parse.Parser;
import org.quillmark.parse.ParserContext;
import org.quillmark.parse.text.DelimitedText;
import org.quillmark.parse.text.TextDelimiter;
import org.quillmark.parse.text.TextParsers;
import org.quillmark.tree.Block;
import org.quillmark.tree.Emphasized;
import org.quillmark.tree.Literal;
import org.quillmark.tree.Paragraph;
import org.quillmark.tree.Span;
import org.quillmark.tree.Strong;
import org.quillmark.tree.Text;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.quillmark.parse.text.TextParsers.ch;

/**
 * The reference markup dialect. It is just large enough to host directives:
 * <ul>
 *     <li>blocks are paragraphs or block directives, separated by blank lines,</li>
 *     <li>spans are {@code *emphasis*}, {@code **strong**}, {@code `literals`},
 *     backslash escapes, span directives and {@code {{references}}}.</li>
 * </ul>
 * Instances are immutable and can be shared between threads.
 */
public class MarkupParsers implements RecursiveParsers {

    private final MarkupDirectiveParsers directiveParsers;
    private final Map<Character, Parser<Span>> spanParsers;
    private final Parser<List<Block>> blocks;

    /**
     * @param spanDirectives The span directives available in documents.
     * @param blockDirectives The block directives available in documents.
     */
    public MarkupParsers(DirectiveRegistry<ISpanDirective> spanDirectives, DirectiveRegistry<IBlockDirective> blockDirectives) {
        this.directiveParsers = new MarkupDirectiveParsers(this, spanDirectives, blockDirectives);
        this.spanParsers = createSpanParsers();
        this.blocks = createBlockParser();
    }

    /**
     * @return The span parsers of this dialect, keyed by their trigger character.
     */
    public Map<Character, Parser<Span>> spanParsers() {
        return spanParsers;
    }

    private Map<Character, Parser<Span>> createSpanParsers() {
        Map<Character, Parser<Span>> parsers = new HashMap<>(directiveParsers.spanParsers());
        parsers.put('\\', escapedChar().map(Text::new));
        parsers.put('*', strong().orElse(emphasized()));
        parsers.put('`', TextParsers.delimitedBy(TextDelimiter.of('`').nonEmpty()).map(Literal::new));
        return Map.copyOf(parsers);
    }

    private Parser<Span> emphasized() {
        DelimitedText<String> text = TextParsers.delimitedBy(TextDelimiter.of('*').nonEmpty());
        return Parser.lazy(() -> recursiveSpans(text).map(Emphasized::new));
    }

    private Parser<Span> strong() {
        DelimitedText<String> text = TextParsers.delimitedBy(TextDelimiter.of("**").nonEmpty());
        return ch('*').keepRight(Parser.lazy(() -> recursiveSpans(text).map(Strong::new)));
    }

    @Override
    public Parser<List<Span>> recursiveSpans(DelimitedText<String> text) {
        return InlineParsers.spans(text, this::spanParsers);
    }

    @Override
    public Parser<List<Span>> delimitedRecursiveSpans(DelimitedText<String> text, Map<Character, Parser<Span>> additionalParsers) {
        return InlineParsers.spans(text, () -> {
            Map<Character, Parser<Span>> merged = new HashMap<>(spanParsers());
            merged.putAll(additionalParsers);
            return merged;
        });
    }

    @Override
    public List<Span> recursiveSpans(String source) {
        Parsed<List<Span>> result = recursiveSpans(TextParsers.untilEnd()).parse(source);
        if (result instanceof Parsed.Success<List<Span>> success) {
            return success.result();
        }
        // text up to the end of input always matches
        throw new IllegalStateException("Unexpected failure parsing spans: " + result);
    }

    @Override
    public List<Block> recursiveBlocks(String source) {
        Parsed<List<Block>> result = blocks.parse(source);
        if (result instanceof Parsed.Success<List<Block>> success) {
            return success.result();
        }
        throw new IllegalStateException("Unexpected failure parsing blocks: " + result);
    }

    /**
     * @return The parser for a sequence of blocks up to the end of input.
     */
    public Parser<List<Block>> blocks() {
        return blocks;
    }

    private Parser<List<Block>> createBlockParser() {
        Parser<Block> directive = directiveParsers.blockDirective();
        Parser<Block> paragraph = paragraph();
        Parser<Block> block = in -> in.charAt(0) == '@' ? directive.orElse(paragraph).parse(in) : paragraph.parse(in);
        return in -> {
            List<Block> result = new ArrayList<>();
            ParserContext current = skipBlankLines(in);
            while (!current.atEnd()) {
                Parsed<Block> parsed = block.parse(current);
                if (!(parsed instanceof Parsed.Success<Block> success)) {
                    return ((Parsed.Failure<Block>) parsed).cast();
                }
                result.add(success.result());
                current = skipBlankLines(success.next());
            }
            return new Parsed.Success<>(List.copyOf(result), current);
        };
    }

    private static ParserContext skipBlankLines(ParserContext in) {
        Parser<List<String>> blankLines = TextParsers.blankLine().rep();
        return blankLines.parse(in).next();
    }

    /**
     * Parses lines up to the next blank line or block directive. The first line
     * always belongs to the paragraph.
     */
    private Parser<Block> paragraph() {
        return in -> {
            String source = in.input();
            int start = in.offset();
            int offset = start;
            while (offset < source.length()) {
                int lineEnd = source.indexOf('\n', offset);
                int next = lineEnd < 0 ? source.length() : lineEnd + 1;
                offset = next;
                if (offset >= source.length()) break;
                int nextLineEnd = source.indexOf('\n', offset);
                String nextLine = source.substring(offset, nextLineEnd < 0 ? source.length() : nextLineEnd);
                if (nextLine.isBlank() || nextLine.startsWith("@:")) break;
            }
            String text = source.substring(start, offset).strip();
            return new Parsed.Success<>(new Paragraph(recursiveSpans(text)), in.consume(offset - start));
        };
    }
}
