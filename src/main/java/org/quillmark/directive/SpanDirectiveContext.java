package org.quillmark.directive;

import org.quillmark.parse.markup.RecursiveParsers;
import org.quillmark.rewrite.DocumentCursor;
import org.quillmark.tree.Span;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The context of a span directive. Part content can be parsed as spans of the
 * enclosing dialect.
 */
public class SpanDirectiveContext extends DirectiveContext {

    private final RecursiveParsers parsers;

    public SpanDirectiveContext(Map<PartKey, String> parts, Optional<DocumentCursor> cursor, RecursiveParsers parsers) {
        super(parts, cursor);
        this.parsers = parsers;
    }

    /**
     * Parses a required part as spans.
     */
    public DirectiveResult<List<Span>> spans(PartKey key) {
        return required(key).map(parsers::recursiveSpans);
    }
}
