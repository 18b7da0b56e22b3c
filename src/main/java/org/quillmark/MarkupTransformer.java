package org.quillmark;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.quillmark.directive.DirectiveRegistry;
import org.quillmark.directive.IBlockDirective;
import org.quillmark.directive.ISpanDirective;
import org.quillmark.directive.std.StandardDirectives;
import org.quillmark.parse.markup.DocumentParser;
import org.quillmark.parse.markup.MarkupParsers;
import org.quillmark.rewrite.PlaceholderRewriter;
import org.quillmark.tree.Document;
import org.quillmark.tree.DocumentTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Orchestrates the processing of a set of markup documents: each document is parsed
 * on its own, then all directives that need the assembled tree are resolved.
 * Instances are immutable and can be shared between threads.
 */
public class MarkupTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(MarkupTransformer.class);

    static final String ENABLE_STANDARD_KEY = "quillmark.directives.enable-standard";
    static final String TREE_CONFIG_KEY = "quillmark.tree.config";
    static final String MAX_NESTING_DEPTH_KEY = "quillmark.rewrite.max-nesting-depth";

    private final DocumentParser documentParser;
    private final PlaceholderRewriter rewriter;
    private final Config treeConfig;

    /**
     * Creates a transformer with the defaults from {@code reference.conf}.
     */
    public MarkupTransformer() {
        this(ConfigFactory.defaultReference());
    }

    public MarkupTransformer(Config config) {
        this(config, DirectiveRegistry.empty(), DirectiveRegistry.empty());
    }

    /**
     * Creates a transformer with additional directives. Directives registered here take
     * precedence over standard directives of the same name.
     *
     * @param config The application configuration.
     * @param spanDirectives Additional span directives.
     * @param blockDirectives Additional block directives.
     */
    public MarkupTransformer(Config config,
                             DirectiveRegistry<ISpanDirective> spanDirectives,
                             DirectiveRegistry<IBlockDirective> blockDirectives) {
        DirectiveRegistry<ISpanDirective> spans = spanDirectives;
        DirectiveRegistry<IBlockDirective> blocks = blockDirectives;
        if (config.getBoolean(ENABLE_STANDARD_KEY)) {
            spans = StandardDirectives.spanDirectives().merge(spanDirectives);
            blocks = StandardDirectives.blockDirectives().merge(blockDirectives);
        }
        LOG.debug("Span directives: {}, block directives: {}", spans.names(), blocks.names());
        this.documentParser = new DocumentParser(new MarkupParsers(spans, blocks));
        this.rewriter = new PlaceholderRewriter(config.getInt(MAX_NESTING_DEPTH_KEY));
        this.treeConfig = config.getConfig(TREE_CONFIG_KEY);
    }

    /**
     * Parses a single document. Placeholders are left in the tree.
     */
    public Document parse(String path, String source) {
        return documentParser.parse(path, source);
    }

    /**
     * Processes a set of documents.
     *
     * @param sources The markup sources by document path, in tree order.
     * @return The tree with all placeholders resolved.
     */
    public DocumentTree transform(Map<String, String> sources) {
        // Phase 1: Parsing, independently per document
        List<Document> documents = sources.entrySet().parallelStream()
                .map(entry -> parse(entry.getKey(), entry.getValue()))
                .toList();
        LOG.debug("Parsed {} documents", documents.size());

        // Phase 2: Placeholder resolution on the assembled tree
        return rewriter.rewrite(new DocumentTree(documents, treeConfig));
    }
}
