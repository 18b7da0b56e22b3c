package org.quillmark.directive;

import org.quillmark.tree.Block;

/**
 * A directive producing a block element.
 */
@FunctionalInterface
public interface IBlockDirective extends IDirective<Block, BlockDirectiveContext> {

    /**
     * Creates a directive that is deferred until the document tree is assembled.
     */
    static IBlockDirective withCursor(IBlockDirective directive) {
        return new IBlockDirective() {
            @Override
            public DirectiveResult<Block> apply(BlockDirectiveContext context) {
                return directive.apply(context);
            }

            @Override
            public boolean requiresContext() {
                return true;
            }
        };
    }
}
