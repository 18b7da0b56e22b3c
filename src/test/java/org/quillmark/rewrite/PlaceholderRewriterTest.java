package org.quillmark.rewrite;

import com.typesafe.config.ConfigFactory;
import org.quillmark.junit.extensions.logging.ExpectLog;
import org.quillmark.junit.extensions.logging.LogLevel;
import org.quillmark.junit.extensions.logging.LogWatchExtension;
import org.quillmark.tree.Block;
import org.quillmark.tree.DirectiveBlock;
import org.quillmark.tree.DirectiveSpan;
import org.quillmark.tree.Document;
import org.quillmark.tree.DocumentTree;
import org.quillmark.tree.InvalidSpan;
import org.quillmark.tree.Literal;
import org.quillmark.tree.LiteralBlock;
import org.quillmark.tree.MarkupContextReference;
import org.quillmark.tree.Paragraph;
import org.quillmark.tree.RootElement;
import org.quillmark.tree.Span;
import org.quillmark.tree.SpanResolver;
import org.quillmark.tree.SpanSequence;
import org.quillmark.tree.Strong;
import org.quillmark.tree.Text;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class PlaceholderRewriterTest {

    private static final Span FALLBACK = new Literal("@:x.");

    private final PlaceholderRewriter rewriter = new PlaceholderRewriter();

    /**
     * A placeholder whose resolution always contains another one of its kind.
     */
    private record Recurring() implements SpanResolver {
        @Override
        public Span resolve(DocumentCursor cursor) {
            return new SpanSequence(List.of(new Recurring()));
        }

        @Override
        public Span fallback() {
            return new Text("recurring");
        }
    }

    private static DocumentTree tree(Span... spans) {
        Document document = new Document("doc.md",
                new RootElement(List.of(new Paragraph(List.of(spans)))),
                ConfigFactory.parseString("title = T"));
        return new DocumentTree(List.of(document), ConfigFactory.empty());
    }

    private static List<Span> spansOf(DocumentTree tree) {
        return ((Paragraph) tree.documents().get(0).content().content().get(0)).content();
    }

    @Test
    @DisplayName("Each placeholder should be resolved exactly once")
    void rewrite_shouldResolveOnce() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        DirectiveSpan placeholder = new DirectiveSpan(cursor -> {
            calls.incrementAndGet();
            return new Text("done");
        }, FALLBACK);

        // Act
        DocumentTree first = rewriter.rewrite(tree(new Text("a "), placeholder));
        DocumentTree second = rewriter.rewrite(first);

        // Assert
        assertThat(spansOf(first)).containsExactly(new Text("a "), new Text("done"));
        assertThat(spansOf(second)).isEqualTo(spansOf(first));
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("A placeholder should refuse to be resolved twice")
    void directiveSpan_shouldRejectSecondResolution() {
        // Arrange
        DirectiveSpan placeholder = new DirectiveSpan(cursor -> new Text("done"), FALLBACK);
        DocumentTree tree = tree(placeholder);
        DocumentCursor cursor = new DocumentCursor(tree.documents().get(0), tree);
        placeholder.resolve(cursor);

        // Act & Assert
        assertThatThrownBy(() -> placeholder.resolve(cursor))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Directive placeholder has already been resolved");
    }

    @Test
    @DisplayName("A placeholder resolving to another placeholder should be rejected")
    void rewrite_shouldRejectNestedPlaceholder() {
        // Arrange
        DirectiveSpan inner = new DirectiveSpan(cursor -> new Text("inner"), new Literal("inner"));
        DirectiveSpan outer = new DirectiveSpan(cursor -> inner, FALLBACK);

        // Act
        DocumentTree result = rewriter.rewrite(tree(outer));

        // Assert
        assertThat(spansOf(result)).containsExactly(InvalidSpan.of(PlaceholderRewriter.NESTED_PLACEHOLDER, FALLBACK));
    }

    @Test
    @DisplayName("Placeholders contained in resolved content should be resolved as well")
    void rewrite_shouldResolveContainedPlaceholders() {
        // Arrange
        DirectiveSpan outer = new DirectiveSpan(cursor -> new Strong(List.of(new MarkupContextReference("title"))), FALLBACK);

        // Act
        DocumentTree result = rewriter.rewrite(tree(outer));

        // Assert
        assertThat(spansOf(result)).containsExactly(new Strong(List.of(new Text("T"))));
    }

    @Test
    @DisplayName("Nesting beyond the maximum depth should produce an invalid element")
    void rewrite_shouldLimitNestingDepth() {
        // Act
        DocumentTree result = new PlaceholderRewriter(1).rewrite(tree(new Recurring()));

        // Assert
        assertThat(spansOf(result)).containsExactly(new SpanSequence(List.of(new SpanSequence(List.of(
                InvalidSpan.of("Maximum placeholder nesting depth of 1 exceeded", new Text("recurring")))))));
    }

    @Test
    @DisplayName("A negative nesting depth should be rejected")
    void constructor_shouldRejectNegativeDepth() {
        // Act & Assert
        assertThatThrownBy(() -> new PlaceholderRewriter(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Error resolving placeholder in doc.md: boom")
    @DisplayName("An exception in a resolver should become an invalid element and be logged")
    void rewrite_shouldContainResolverExceptions() {
        // Arrange
        DirectiveSpan failing = new DirectiveSpan(cursor -> {
            throw new IllegalArgumentException("boom");
        }, FALLBACK);

        // Act
        DocumentTree result = rewriter.rewrite(tree(new Text("a"), failing, new Text("b")));

        // Assert
        assertThat(spansOf(result)).containsExactly(
                new Text("a"), InvalidSpan.of("Error resolving placeholder: boom", FALLBACK), new Text("b"));
    }

    @Test
    @DisplayName("Missing references should become invalid spans with the reference as fallback")
    void rewrite_shouldReportMissingReference() {
        // Act
        DocumentTree result = rewriter.rewrite(tree(new MarkupContextReference("missing")));

        // Assert
        assertThat(spansOf(result)).containsExactly(
                InvalidSpan.of("Missing value for reference: missing", new Text("{{missing}}")));
    }

    @Test
    @DisplayName("Block placeholders should be replaced by their result")
    void rewrite_shouldResolveBlocks() {
        // Arrange
        Block paragraph = new Paragraph(List.of(new Text("resolved")));
        Document document = new Document("doc.md",
                new RootElement(List.of(new DirectiveBlock(cursor -> paragraph, new LiteralBlock("@:x.")))),
                ConfigFactory.empty());

        // Act
        DocumentTree result = rewriter.rewrite(new DocumentTree(List.of(document), ConfigFactory.empty()));

        // Assert
        assertThat(result.documents().get(0).content().content()).containsExactly(paragraph);
    }

    @Test
    @DisplayName("Documents without placeholders should be kept as they are")
    void rewrite_shouldKeepUnchangedDocuments() {
        // Arrange
        DocumentTree tree = tree(new Text("plain"));

        // Act
        DocumentTree result = rewriter.rewrite(tree);

        // Assert
        assertThat(result.documents().get(0)).isSameAs(tree.documents().get(0));
    }

    @Test
    @ExpectLog(level = LogLevel.DEBUG, loggerPattern = ".*PlaceholderRewriter", messagePattern = "Resolved 3 placeholders in doc\\.md")
    @DisplayName("Every resolved placeholder should be counted, including custom ones")
    void rewrite_shouldCountResolvedPlaceholders() {
        // Arrange
        SpanResolver custom = new SpanResolver() {
            @Override
            public Span resolve(DocumentCursor cursor) {
                return new Text("custom");
            }

            @Override
            public Span fallback() {
                return FALLBACK;
            }
        };

        // Act
        DocumentTree result = rewriter.rewrite(tree(
                custom, new MarkupContextReference("title"), new DirectiveSpan(cursor -> new Text("d"), FALLBACK)));

        // Assert
        assertThat(spansOf(result)).containsExactly(new Text("custom"), new Text("T"), new Text("d"));
    }
}
