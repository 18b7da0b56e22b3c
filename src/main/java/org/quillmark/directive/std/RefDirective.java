package org.quillmark.directive.std;

import org.quillmark.directive.DirectiveResult;
import org.quillmark.directive.ISpanDirective;
import org.quillmark.directive.PartKey;
import org.quillmark.directive.SpanDirectiveContext;
import org.quillmark.rewrite.DocumentCursor;
import org.quillmark.tree.Span;
import org.quillmark.tree.Text;

import java.util.Optional;

/**
 * {@code @:ref "document.title".} inserts a configuration value of the document or the tree.
 * Resolved once the tree is assembled.
 */
public class RefDirective implements ISpanDirective {

    @Override
    public DirectiveResult<Span> apply(SpanDirectiveContext context) {
        return context.requiredCursor()
                .flatMap(cursor -> context.required(PartKey.attribute()).flatMap(path -> resolve(cursor, path)));
    }

    private static DirectiveResult<Span> resolve(DocumentCursor cursor, String path) {
        Optional<String> value = cursor.resolveReference(path);
        if (value.isPresent()) {
            return DirectiveResult.success(new Text(value.get()));
        }
        return DirectiveResult.failure("Missing value for reference: " + path);
    }

    @Override
    public boolean requiresContext() {
        return true;
    }
}
