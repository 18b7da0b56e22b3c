package org.quillmark.tree;

/**
 * A message produced while parsing or processing a document, embedded in the tree
 * at the position it refers to.
 *
 * @param level The severity.
 * @param content The message text.
 */
public record SystemMessage(MessageLevel level, String content) implements Span {

    public static SystemMessage error(String content) {
        return new SystemMessage(MessageLevel.ERROR, content);
    }
}
