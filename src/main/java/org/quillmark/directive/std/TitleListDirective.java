package org.quillmark.directive.std;

import org.quillmark.directive.BlockDirectiveContext;
import org.quillmark.directive.DirectiveResult;
import org.quillmark.directive.IBlockDirective;
import org.quillmark.rewrite.DocumentCursor;
import org.quillmark.tree.Block;
import org.quillmark.tree.BlockSequence;
import org.quillmark.tree.Document;
import org.quillmark.tree.Paragraph;
import org.quillmark.tree.Text;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code @:title-list.} lists the titles of all documents in the tree, one paragraph each.
 * Documents without a {@value #TITLE_KEY} in their header are listed by path.
 */
public class TitleListDirective implements IBlockDirective {

    static final String TITLE_KEY = "title";

    @Override
    public DirectiveResult<Block> apply(BlockDirectiveContext context) {
        return context.requiredCursor().map(TitleListDirective::titles);
    }

    private static Block titles(DocumentCursor cursor) {
        List<Block> entries = new ArrayList<>();
        for (Document document : cursor.tree().documents()) {
            String title = document.config().hasPath(TITLE_KEY)
                    ? document.config().getString(TITLE_KEY)
                    : document.path();
            entries.add(new Paragraph(List.of(new Text(title))));
        }
        return new BlockSequence(entries);
    }

    @Override
    public boolean requiresContext() {
        return true;
    }
}
