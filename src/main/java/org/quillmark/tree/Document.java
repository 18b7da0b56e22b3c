package org.quillmark.tree;

import com.typesafe.config.Config;

/**
 * A single parsed document.
 *
 * @param path The logical path of the document within its tree.
 * @param content The parsed content.
 * @param config The configuration from the document header, empty if there is none.
 */
public record Document(String path, RootElement content, Config config) {

    /**
     * @return A copy of this document with different content.
     */
    public Document withContent(RootElement newContent) {
        return new Document(path, newContent, config);
    }
}
