package org.quillmark.rewrite;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.quillmark.tree.Document;
import org.quillmark.tree.DocumentTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The position of a document within the assembled document tree, handed to
 * placeholders when they are resolved.
 */
public final class DocumentCursor {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentCursor.class);

    private final Document document;
    private final DocumentTree tree;
    private final Config config;

    public DocumentCursor(Document document, DocumentTree tree) {
        this.document = document;
        this.tree = tree;
        this.config = document.config()
                .withFallback(tree.config())
                .withFallback(ConfigFactory.parseMap(Map.of("document.path", document.path())));
    }

    public Document document() {
        return document;
    }

    public DocumentTree tree() {
        return tree;
    }

    /**
     * @return The configuration of the document, falling back to the configuration of the tree.
     *         The path of the document is available as {@code document.path}.
     */
    public Config config() {
        return config;
    }

    /**
     * Looks up a scalar configuration value.
     *
     * @param path The configuration path, e.g. {@code document.title}.
     * @return The value as text, or empty if the path is missing, malformed or not a scalar.
     */
    public Optional<String> resolveReference(String path) {
        try {
            if (!config.hasPath(path)) {
                return Optional.empty();
            }
            ConfigValue value = config.getValue(path);
            if (value.valueType() == ConfigValueType.OBJECT || value.valueType() == ConfigValueType.LIST) {
                LOG.debug("Reference {} in {} is not a scalar value", path, document.path());
                return Optional.empty();
            }
            return Optional.of(String.valueOf(value.unwrapped()));
        } catch (ConfigException.BadPath e) {
            LOG.debug("Invalid reference path {} in {}: {}", path, document.path(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @return All other documents of the tree, in tree order.
     */
    public List<Document> siblings() {
        return tree.documents().stream()
                .filter(d -> !d.path().equals(document.path()))
                .toList();
    }
}
