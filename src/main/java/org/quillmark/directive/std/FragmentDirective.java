package org.quillmark.directive.std;

import org.quillmark.directive.BlockDirectiveContext;
import org.quillmark.directive.DirectiveResult;
import org.quillmark.directive.IBlockDirective;
import org.quillmark.directive.PartKey;
import org.quillmark.tree.Block;
import org.quillmark.tree.Fragment;

/**
 * {@code @:fragment sidebar: ...} moves its body out of the main flow of the document.
 */
public class FragmentDirective implements IBlockDirective {

    @Override
    public DirectiveResult<Block> apply(BlockDirectiveContext context) {
        return context.required(PartKey.attribute())
                .combine(context.blocks(PartKey.body()), Fragment::new);
    }
}
