package org.quillmark.tree;

import com.typesafe.config.Config;

import java.util.List;
import java.util.Optional;

/**
 * A set of documents processed together. Placeholders are resolved against the
 * complete tree.
 *
 * @param documents The documents in input order.
 * @param config The configuration shared by all documents.
 */
public record DocumentTree(List<Document> documents, Config config) {

    public DocumentTree {
        documents = List.copyOf(documents);
    }

    public Optional<Document> document(String path) {
        return documents.stream().filter(d -> d.path().equals(path)).findFirst();
    }
}
