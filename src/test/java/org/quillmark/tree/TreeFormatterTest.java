package org.quillmark.tree;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TreeFormatterTest {

    @Test
    @DisplayName("Should print one element per line, indented by depth")
    void format_shouldIndentByDepth() {
        // Arrange
        RootElement root = new RootElement(List.of(
                new Callout("warn", List.of(new Paragraph(List.of(
                        new Text("a"), new StyledSpan("hint", List.of(new Literal("b"))))))),
                InvalidBlock.of("broken", new LiteralBlock("@:x."))));

        // Act
        String formatted = TreeFormatter.format(root);

        // Assert
        assertThat(formatted).isEqualTo("""
                RootElement
                . Callout(warn)
                . . Paragraph
                . . . Text - 'a'
                . . . StyledSpan(hint)
                . . . . Literal - 'b'
                . InvalidBlock - ERROR: broken - fallback: LiteralBlock[content=@:x.]
                """);
    }

    @Test
    @DisplayName("withChildren should rebuild containers and narrow their children")
    void withChildren_shouldRebuildContainers() {
        // Arrange
        Paragraph paragraph = new Paragraph(List.of(new Text("old")));

        // Act
        Element rebuilt = paragraph.withChildren(List.of(new Text("new")));

        // Assert
        assertThat(rebuilt).isEqualTo(new Paragraph(List.of(new Text("new"))));
        assertThat(new Text("leaf").withChildren(List.of())).isEqualTo(new Text("leaf"));
    }
}
