package org.quillmark.tree;

/**
 * A span that could not be processed.
 *
 * @param message The reason.
 * @param fallback The literal source of the span.
 */
public record InvalidSpan(SystemMessage message, Span fallback) implements Span, Invalid {

    public static InvalidSpan of(String message, Span fallback) {
        return new InvalidSpan(SystemMessage.error(message), fallback);
    }
}
