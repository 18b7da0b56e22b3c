package org.quillmark.rewrite;

import org.quillmark.tree.Block;
import org.quillmark.tree.BlockResolver;
import org.quillmark.tree.Document;
import org.quillmark.tree.DocumentTree;
import org.quillmark.tree.Element;
import org.quillmark.tree.InvalidBlock;
import org.quillmark.tree.InvalidSpan;
import org.quillmark.tree.RootElement;
import org.quillmark.tree.Span;
import org.quillmark.tree.SpanResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The second phase of processing: replaces every placeholder in an assembled
 * document tree with the element it resolves to.
 * <p>
 * Each placeholder is resolved exactly once, with the cursor of its document.
 * Failures never abort the rewrite; a failing placeholder is replaced by an invalid
 * element carrying its fallback.
 */
public class PlaceholderRewriter {

    private static final Logger LOG = LoggerFactory.getLogger(PlaceholderRewriter.class);

    /** The default limit for placeholders introduced by resolved placeholders. */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 16;

    static final String NESTED_PLACEHOLDER = "Directive resolution produced an unresolved placeholder";

    private final int maxNestingDepth;

    public PlaceholderRewriter() {
        this(DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * @param maxNestingDepth How deep placeholders contained in resolved content are followed.
     */
    public PlaceholderRewriter(int maxNestingDepth) {
        if (maxNestingDepth < 0) {
            throw new IllegalArgumentException("Nesting depth must not be negative: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Resolves all placeholders of all documents.
     *
     * @param tree The fully assembled tree.
     * @return A new tree without placeholders.
     */
    public DocumentTree rewrite(DocumentTree tree) {
        List<Document> documents = new ArrayList<>(tree.documents().size());
        for (Document document : tree.documents()) {
            documents.add(rewrite(document, tree));
        }
        return new DocumentTree(documents, tree.config());
    }

    private Document rewrite(Document document, DocumentTree tree) {
        DocumentRewrite rewrite = new DocumentRewrite(new DocumentCursor(document, tree));
        Element content = rewrite.transform(document.content(), 0);
        LOG.debug("Resolved {} placeholders in {}", rewrite.resolved, document.path());
        return content == document.content() ? document : document.withContent((RootElement) content);
    }

    /**
     * The resolution state of a single document.
     */
    private final class DocumentRewrite {

        private final DocumentCursor cursor;
        private int resolved;

        DocumentRewrite(DocumentCursor cursor) {
            this.cursor = cursor;
        }

        Element transform(Element element, int depth) {
            TreeWalker walker = new TreeWalker(Map.of());
            return walker.transform(element, e -> {
                if (e instanceof SpanResolver resolver) return resolveSpan(resolver, depth);
                if (e instanceof BlockResolver resolver) return resolveBlock(resolver, depth);
                return null;
            });
        }

        private Span resolveSpan(SpanResolver resolver, int depth) {
            if (depth > maxNestingDepth) {
                return InvalidSpan.of("Maximum placeholder nesting depth of " + maxNestingDepth + " exceeded", resolver.fallback());
            }
            resolved++;
            Span result;
            try {
                result = resolver.resolve(cursor);
            } catch (RuntimeException e) {
                LOG.warn("Error resolving placeholder in {}: {}", cursor.document().path(), e.getMessage(), e);
                return InvalidSpan.of("Error resolving placeholder: " + e.getMessage(), resolver.fallback());
            }
            if (result instanceof SpanResolver) {
                return InvalidSpan.of(NESTED_PLACEHOLDER, resolver.fallback());
            }
            return (Span) transform(result, depth + 1);
        }

        private Block resolveBlock(BlockResolver resolver, int depth) {
            if (depth > maxNestingDepth) {
                return InvalidBlock.of("Maximum placeholder nesting depth of " + maxNestingDepth + " exceeded", resolver.fallback());
            }
            resolved++;
            Block result;
            try {
                result = resolver.resolve(cursor);
            } catch (RuntimeException e) {
                LOG.warn("Error resolving placeholder in {}: {}", cursor.document().path(), e.getMessage(), e);
                return InvalidBlock.of("Error resolving placeholder: " + e.getMessage(), resolver.fallback());
            }
            if (result instanceof BlockResolver) {
                return InvalidBlock.of(NESTED_PLACEHOLDER, resolver.fallback());
            }
            return (Block) transform(result, depth + 1);
        }
    }
}
