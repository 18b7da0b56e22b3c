package org.quillmark.directive.std;

import org.quillmark.directive.DirectiveResult;
import org.quillmark.directive.ISpanDirective;
import org.quillmark.directive.PartKey;
import org.quillmark.directive.SpanDirectiveContext;
import org.quillmark.tree.Literal;
import org.quillmark.tree.Span;

/**
 * {@code @:literal: {*not emphasized*}} keeps its body verbatim.
 */
public class LiteralDirective implements ISpanDirective {

    @Override
    public DirectiveResult<Span> apply(SpanDirectiveContext context) {
        return context.required(PartKey.body()).map(Literal::new);
    }
}
