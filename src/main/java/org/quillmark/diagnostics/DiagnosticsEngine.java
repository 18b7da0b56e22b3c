package org.quillmark.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages about processed documents.
 * <p>
 * This decouples error reporting from the code that detects the errors.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message      The error message.
     * @param documentPath The document in which the error occurred.
     * @param source       The source of the affected element.
     */
    public void reportError(String message, String documentPath, String source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, documentPath, source));
    }

    /**
     * Reports a warning.
     *
     * @param message      The warning message.
     * @param documentPath The document in which the issue occurred.
     * @param source       The source of the affected element.
     */
    public void reportWarning(String message, String documentPath, String source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, documentPath, source));
    }

    public void reportInfo(String message, String documentPath, String source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.INFO, message, documentPath, source));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
