package org.quillmark.tree;

import org.quillmark.rewrite.DocumentCursor;

/**
 * A reference like {@code {{document.title}}} to a value of the document or tree
 * configuration, resolved once the tree is assembled.
 *
 * @param ref The configuration path.
 */
public record MarkupContextReference(String ref) implements SpanResolver {

    @Override
    public Span resolve(DocumentCursor cursor) {
        return cursor.resolveReference(ref)
                .<Span>map(Text::new)
                .orElseGet(() -> InvalidSpan.of("Missing value for reference: " + ref, fallback()));
    }

    @Override
    public Span fallback() {
        return new Text("{{" + ref + "}}");
    }
}
