package org.quillmark.css;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@Tag("unit")
class CssParsersTest {

    private final CssParsers parsers = new CssParsers();

    @Test
    @DisplayName("Should parse a type selector with its styles in declaration order")
    void shouldParseSimpleDeclaration() throws StyleSheetParseException {
        // Act
        StyleDeclarationSet set = parsers.parseStyleSheet("style.css", "Paragraph { color: red; font-size: 12px; }");

        // Assert
        assertThat(set.path()).isEqualTo("style.css");
        assertThat(set.declarations()).hasSize(1);
        StyleDeclaration declaration = set.declarations().get(0);
        assertThat(declaration.selector().predicates()).containsExactly(new StylePredicate.ElementType("Paragraph"));
        assertThat(declaration.styles()).containsExactly(Map.entry("color", "red"), Map.entry("font-size", "12px"));
    }

    @Test
    @DisplayName("Should parse combinators and selector groups")
    void shouldParseCombinatorsAndGroups() throws StyleSheetParseException {
        // Act
        StyleDeclarationSet set = parsers.parseStyleSheet("style.css", "Callout > Paragraph.note, #main * {\n  margin: 0;\n}\n");

        // Assert
        List<StyleDeclaration> declarations = set.declarations();
        assertThat(declarations).hasSize(2);

        Selector child = declarations.get(0).selector();
        assertThat(child.predicates()).containsExactlyInAnyOrder(
                new StylePredicate.ElementType("Paragraph"), new StylePredicate.StyleName("note"));
        assertThat(child.parentSelector()).contains(
                new ParentSelector(new Selector(Set.of(new StylePredicate.ElementType("Callout"))), true));
        assertThat(child.order()).isZero();

        Selector descendant = declarations.get(1).selector();
        assertThat(descendant.predicates()).isEmpty();
        assertThat(descendant.parentSelector()).contains(
                new ParentSelector(new Selector(Set.of(new StylePredicate.Id("main"))), false));
        assertThat(descendant.order()).isEqualTo(1);
    }

    @Test
    @DisplayName("Comments should be ignored between and inside declarations")
    void shouldIgnoreComments() throws StyleSheetParseException {
        // Arrange
        String source = "/* header */\nStrong { /* inline */ color: blue; border: 1px /* note */; /* trailing */ }\n/* footer */";

        // Act
        StyleDeclarationSet set = parsers.parseStyleSheet("style.css", source);

        // Assert
        assertThat(set.declarations()).hasSize(1);
        assertThat(set.declarations().get(0).styles()).containsExactly(Map.entry("color", "blue"), Map.entry("border", "1px"));
    }

    @Test
    @DisplayName("Declarations should be ordered by specificity, then by position")
    void bySpecificity_shouldOrderDeclarations() throws StyleSheetParseException {
        // Act
        StyleDeclarationSet set = parsers.parseStyleSheet("style.css",
                "#a { x: 1; }\n.b.c { x: 2; }\nP { x: 3; }\nQ { x: 4; }");

        // Assert
        assertThat(set.bySpecificity()).extracting(d -> d.styles().get("x")).containsExactly("3", "4", "2", "1");
    }

    @Test
    @DisplayName("An empty style sheet should produce no declarations")
    void shouldAcceptEmptyStyleSheet() throws StyleSheetParseException {
        // Act & Assert
        assertThat(parsers.parseStyleSheet("empty.css", "  \n/* nothing */\n").declarations()).isEmpty();
    }

    @Test
    @DisplayName("Malformed input should fail with the position of the problem")
    void shouldFailOnMalformedInput() {
        // Act
        StyleSheetParseException exception = catchThrowableOfType(
                () -> parsers.parseStyleSheet("style.css", "A { x: 1; }\n\nB { y 2; }"),
                StyleSheetParseException.class);

        // Assert
        assertThat(exception).isNotNull();
        assertThat(exception.getPath()).isEqualTo("style.css");
        assertThat(exception.getPosition().line()).isEqualTo(3);
        assertThat(exception.getPosition().column()).isEqualTo(5);
        assertThat(exception.getMessage()).startsWith("Expected '}'").contains("style.css[3.5]");
    }

    @Test
    @DisplayName("Unsupported selectors should not be skipped silently")
    void shouldRejectUnsupportedSelectors() {
        // Act & Assert
        assertThatThrownBy(() -> parsers.parseStyleSheet("style.css", "a:hover { color: red; }"))
                .isInstanceOf(StyleSheetParseException.class);
    }
}
