package org.quillmark.parse.markup;

import org.quillmark.parse.Parser;
import org.quillmark.parse.text.DelimitedText;
import org.quillmark.tree.Block;
import org.quillmark.tree.Span;

import java.util.List;
import java.util.Map;

/**
 * Gives parsers of nested constructs, such as directives, access to the full
 * grammar of the enclosing dialect.
 */
public interface RecursiveParsers extends EscapedTextParsers {

    /**
     * Parses spans up to the end of the given text parser with all span parsers of the dialect.
     */
    Parser<List<Span>> recursiveSpans(DelimitedText<String> text);

    /**
     * Like {@link #recursiveSpans(DelimitedText)}, with additional span parsers that take
     * precedence over the dialect's parsers for the same start character.
     */
    Parser<List<Span>> delimitedRecursiveSpans(DelimitedText<String> text, Map<Character, Parser<Span>> additionalParsers);

    /**
     * Parses the complete source as spans.
     */
    List<Span> recursiveSpans(String source);

    /**
     * Parses the complete source as blocks.
     */
    List<Block> recursiveBlocks(String source);
}
