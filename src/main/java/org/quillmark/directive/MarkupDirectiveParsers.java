package org.quillmark.directive;

import org.quillmark.parse.Pair;
import org.quillmark.parse.Parser;
import org.quillmark.parse.markup.BlockParsers;
import org.quillmark.parse.markup.RecursiveParsers;
import org.quillmark.parse.text.TextParsers;
import org.quillmark.tree.Block;
import org.quillmark.tree.DirectiveBlock;
import org.quillmark.tree.DirectiveSpan;
import org.quillmark.tree.InvalidBlock;
import org.quillmark.tree.InvalidSpan;
import org.quillmark.tree.Literal;
import org.quillmark.tree.LiteralBlock;
import org.quillmark.tree.MarkupContextReference;
import org.quillmark.tree.Span;
import org.quillmark.tree.Text;

import java.util.Map;

import static org.quillmark.parse.text.TextParsers.ch;
import static org.quillmark.parse.text.TextParsers.literal;

/**
 * Wires directives into the markup dialect.
 * <ul>
 *     <li>Span directives start with {@code @:name}, and their bodies are enclosed in braces.</li>
 *     <li>Block directives start with {@code @:name} at the start of a block, and their bodies
 *     are the rest of the line plus the following indented lines.</li>
 *     <li>Context references like {@code {{document.title}}} become placeholders.</li>
 * </ul>
 */
public class MarkupDirectiveParsers {

    private final RecursiveParsers recursiveParsers;
    private final DirectiveRegistry<ISpanDirective> spanDirectives;
    private final DirectiveRegistry<IBlockDirective> blockDirectives;
    private final DirectiveParsers grammar;

    /**
     * @param recursiveParsers The parsers of the enclosing dialect, used for the content of bodies.
     * @param spanDirectives The registered span directives.
     * @param blockDirectives The registered block directives.
     */
    public MarkupDirectiveParsers(RecursiveParsers recursiveParsers,
                                  DirectiveRegistry<ISpanDirective> spanDirectives,
                                  DirectiveRegistry<IBlockDirective> blockDirectives) {
        this.recursiveParsers = recursiveParsers;
        this.spanDirectives = spanDirectives;
        this.blockDirectives = blockDirectives;
        this.grammar = new DirectiveParsers(recursiveParsers);
    }

    /**
     * @return The span parsers contributed by directives, keyed by their trigger character.
     */
    public Map<Character, Parser<Span>> spanParsers() {
        return Map.of('@', spanDirective(), '{', contextReference());
    }

    /**
     * Parses a span directive after its {@code '@'} trigger.
     */
    public Parser<Span> spanDirective() {
        return grammar.directiveParser(spanBody(), false)
                .withSource()
                .map(this::applySpanDirective);
    }

    /**
     * Parses a braced span directive body with the full span grammar of the dialect, so that
     * a closing brace inside a nested construct does not end the body. Unmatched opening
     * braces are balanced like in {@link DirectiveParsers#nestedBraces()}.
     */
    public Parser<String> spanBody() {
        Parser<Span> brace = contextReference().orElse(DirectiveParsers.nestedBraces().<Span>map(Text::new));
        return DirectiveParsers.bracedBody(
                recursiveParsers.delimitedRecursiveSpans(TextParsers.delimitedBy('}'), Map.of('{', brace)));
    }

    private Span applySpanDirective(Pair<ParsedDirective, String> parsed) {
        Span fallback = new Literal("@" + parsed.second());
        return DirectiveParsers.applyDirective(
                spanDirectives,
                parsed.first(),
                (parts, cursor) -> new SpanDirectiveContext(parts, cursor, recursiveParsers),
                resolver -> new DirectiveSpan(resolver, fallback),
                message -> InvalidSpan.of(message, fallback),
                "span");
    }

    /**
     * Parses a block directive, including its {@code '@'} start character.
     */
    public Parser<Block> blockDirective() {
        Parser<String> body = BlockParsers.indentedBlock()
                .map(String::trim)
                .filter(content -> !content.isEmpty(), "empty body");
        return grammar.directiveParser(body, true)
                .keepLeft(endOfLine())
                .withSource()
                .map(this::applyBlockDirective);
    }

    private Block applyBlockDirective(Pair<ParsedDirective, String> parsed) {
        Block fallback = new LiteralBlock(parsed.second());
        return DirectiveParsers.applyDirective(
                blockDirectives,
                parsed.first(),
                (parts, cursor) -> new BlockDirectiveContext(parts, cursor, recursiveParsers),
                resolver -> new DirectiveBlock(resolver, fallback),
                message -> InvalidBlock.of(message, fallback),
                "block");
    }

    /**
     * Parses a context reference after its first {@code '{'}.
     */
    public Parser<Span> contextReference() {
        return ch('{').then(TextParsers.WS)
                .keepRight(TextParsers.refName())
                .keepLeft(TextParsers.WS.then(literal("}}")))
                .map(MarkupContextReference::new);
    }

    /**
     * Succeeds at the start of a line or at the end of input, otherwise consumes
     * trailing whitespace and the line break.
     */
    private static Parser<Void> endOfLine() {
        Parser<Void> lineBreak = TextParsers.WS.then(ch('\n').orElse(Parser.eof().as(""))).as(null);
        return in -> {
            if (in.atEnd() || in.offset() > 0 && in.charAt(-1) == '\n') {
                return Parser.<Void>success(null).parse(in);
            }
            return lineBreak.parse(in);
        };
    }
}
