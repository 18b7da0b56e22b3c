package org.quillmark.diagnostics;

import org.quillmark.rewrite.TreeWalker;
import org.quillmark.tree.Document;
import org.quillmark.tree.DocumentTree;
import org.quillmark.tree.Element;
import org.quillmark.tree.Invalid;
import org.quillmark.tree.InvalidBlock;
import org.quillmark.tree.InvalidSpan;
import org.quillmark.tree.Literal;
import org.quillmark.tree.LiteralBlock;
import org.quillmark.tree.SystemMessage;
import org.quillmark.tree.Text;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Reports every invalid element of a document tree to a {@link DiagnosticsEngine}.
 */
public class InvalidElementCollector {

    private final DiagnosticsEngine diagnostics;

    public InvalidElementCollector(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    public void collect(DocumentTree tree) {
        for (Document document : tree.documents()) {
            collect(document);
        }
    }

    public void collect(Document document) {
        Consumer<Element> report = element -> report((Invalid) element, document.path());
        TreeWalker walker = new TreeWalker(Map.of(InvalidSpan.class, report, InvalidBlock.class, report));
        walker.walk(document.content());
    }

    private void report(Invalid invalid, String path) {
        SystemMessage message = invalid.message();
        String source = sourceOf(invalid.fallback());
        switch (message.level()) {
            case DEBUG, INFO -> diagnostics.reportInfo(message.content(), path, source);
            case WARNING -> diagnostics.reportWarning(message.content(), path, source);
            case ERROR, FATAL -> diagnostics.reportError(message.content(), path, source);
        }
    }

    private static String sourceOf(Element fallback) {
        if (fallback instanceof Text text) return text.content();
        if (fallback instanceof Literal literal) return literal.content();
        if (fallback instanceof LiteralBlock block) return block.content();
        return String.valueOf(fallback);
    }
}
