package org.quillmark.directive.std;

import org.quillmark.directive.DirectiveResult;
import org.quillmark.directive.ISpanDirective;
import org.quillmark.directive.PartKey;
import org.quillmark.directive.SpanDirectiveContext;
import org.quillmark.tree.Span;
import org.quillmark.tree.StyledSpan;

/**
 * {@code @:style highlight: {some *text*}} applies a named style to its body.
 */
public class StyleDirective implements ISpanDirective {

    @Override
    public DirectiveResult<Span> apply(SpanDirectiveContext context) {
        return context.required(PartKey.attribute())
                .combine(context.spans(PartKey.body()), StyledSpan::new);
    }
}
