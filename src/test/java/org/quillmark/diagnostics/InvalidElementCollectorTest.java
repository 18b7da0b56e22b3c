package org.quillmark.diagnostics;

import com.typesafe.config.ConfigFactory;
import org.quillmark.tree.Callout;
import org.quillmark.tree.Document;
import org.quillmark.tree.DocumentTree;
import org.quillmark.tree.InvalidBlock;
import org.quillmark.tree.InvalidSpan;
import org.quillmark.tree.Literal;
import org.quillmark.tree.LiteralBlock;
import org.quillmark.tree.MessageLevel;
import org.quillmark.tree.Paragraph;
import org.quillmark.tree.RootElement;
import org.quillmark.tree.SystemMessage;
import org.quillmark.tree.Text;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class InvalidElementCollectorTest {

    private DiagnosticsEngine diagnostics;
    private InvalidElementCollector collector;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        collector = new InvalidElementCollector(diagnostics);
    }

    private static Document document(String path, RootElement content) {
        return new Document(path, content, ConfigFactory.empty());
    }

    @Test
    @DisplayName("Invalid elements at any depth should be reported with their source")
    void collect_shouldReportNestedInvalidElements() {
        // Arrange
        RootElement content = new RootElement(List.of(
                InvalidBlock.of("bad block", new LiteralBlock("@:x.")),
                new Callout("info", List.of(new Paragraph(List.of(
                        new Text("a"), InvalidSpan.of("bad span", new Literal("@:y.")))))),
                new Paragraph(List.of(new Text("fine")))));

        // Act
        collector.collect(new DocumentTree(List.of(document("doc.md", content)), ConfigFactory.empty()));

        // Assert
        assertThat(diagnostics.getDiagnostics()).containsExactlyInAnyOrder(
                new Diagnostic(Diagnostic.Type.ERROR, "bad block", "doc.md", "@:x."),
                new Diagnostic(Diagnostic.Type.ERROR, "bad span", "doc.md", "@:y."));
        assertThat(diagnostics.hasErrors()).isTrue();
    }

    @Test
    @DisplayName("Message levels should map to diagnostic types")
    void collect_shouldMapMessageLevels() {
        // Arrange
        RootElement content = new RootElement(List.of(new Paragraph(List.of(
                new InvalidSpan(new SystemMessage(MessageLevel.WARNING, "careful"), new Text("w")),
                new InvalidSpan(new SystemMessage(MessageLevel.INFO, "note"), new Text("i"))))));

        // Act
        collector.collect(document("doc.md", content));

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::type)
                .containsExactly(Diagnostic.Type.WARNING, Diagnostic.Type.INFO);
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.summary()).isEqualTo("[WARNING] doc.md: careful (w)\n[INFO] doc.md: note (i)");
    }

    @Test
    @DisplayName("A document without invalid elements should produce no diagnostics")
    void collect_shouldIgnoreValidDocuments() {
        // Act
        collector.collect(document("doc.md", new RootElement(List.of(new Paragraph(List.of(new Text("ok")))))));

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(diagnostics.summary()).isEmpty();
    }
}
