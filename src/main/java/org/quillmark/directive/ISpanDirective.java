package org.quillmark.directive;

import org.quillmark.tree.Span;

/**
 * A directive producing an inline element.
 */
@FunctionalInterface
public interface ISpanDirective extends IDirective<Span, SpanDirectiveContext> {

    /**
     * Creates a directive that is deferred until the document tree is assembled.
     */
    static ISpanDirective withCursor(ISpanDirective directive) {
        return new ISpanDirective() {
            @Override
            public DirectiveResult<Span> apply(SpanDirectiveContext context) {
                return directive.apply(context);
            }

            @Override
            public boolean requiresContext() {
                return true;
            }
        };
    }
}
