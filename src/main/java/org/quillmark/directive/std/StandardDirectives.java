package org.quillmark.directive.std;

import org.quillmark.directive.DirectiveRegistry;
import org.quillmark.directive.IBlockDirective;
import org.quillmark.directive.ISpanDirective;

/**
 * The directives available in every document unless disabled in the configuration.
 */
public final class StandardDirectives {

    private StandardDirectives() {}

    /**
     * @return A new registry with the span directives {@code ref}, {@code style} and {@code literal}.
     */
    public static DirectiveRegistry<ISpanDirective> spanDirectives() {
        return DirectiveRegistry.<ISpanDirective>builder()
                .register("ref", new RefDirective())
                .register("style", new StyleDirective())
                .register("literal", new LiteralDirective())
                .build();
    }

    /**
     * @return A new registry with the block directives {@code callout}, {@code fragment} and {@code title-list}.
     */
    public static DirectiveRegistry<IBlockDirective> blockDirectives() {
        return DirectiveRegistry.<IBlockDirective>builder()
                .register("callout", new CalloutDirective())
                .register("fragment", new FragmentDirective())
                .register("title-list", new TitleListDirective())
                .build();
    }
}
