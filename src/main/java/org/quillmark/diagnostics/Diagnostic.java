package org.quillmark.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info)
 * about the content of a document.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param documentPath The path of the document the issue occurred in.
 * @param source The source text of the affected element.
 */
public record Diagnostic(
        Type type,
        String message,
        String documentPath,
        String source
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** Content that could not be processed. */
        ERROR,
        /** Content that was processed with reservations. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s (%s)", type, documentPath, message, source);
    }
}
