package org.quillmark.directive.std;

import org.quillmark.directive.BlockDirectiveContext;
import org.quillmark.directive.DirectiveResult;
import org.quillmark.directive.IBlockDirective;
import org.quillmark.directive.PartKey;
import org.quillmark.tree.Block;
import org.quillmark.tree.Callout;

/**
 * {@code @:callout type=warn: ...} wraps its body in a highlighted box.
 * The type defaults to {@value #DEFAULT_TYPE}.
 */
public class CalloutDirective implements IBlockDirective {

    static final String DEFAULT_TYPE = "info";

    @Override
    public DirectiveResult<Block> apply(BlockDirectiveContext context) {
        String type = context.attribute("type").orElse(DEFAULT_TYPE);
        return context.blocks(PartKey.body()).map(blocks -> new Callout(type, blocks));
    }
}
