package org.quillmark.directive;

/**
 * A single attribute or body of a parsed directive.
 *
 * @param key The key of the part.
 * @param content The raw, unparsed content.
 */
public record Part(PartKey key, String content) {}
