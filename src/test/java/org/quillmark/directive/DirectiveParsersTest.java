package org.quillmark.directive;

import org.quillmark.parse.Parsed;
import org.quillmark.parse.Parser;
import org.quillmark.parse.markup.InlineParsers;
import org.quillmark.parse.text.TextParsers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DirectiveParsersTest {

    private static final Parser<String> BRACED = DirectiveParsers.bracedBody(
            InlineParsers.text(TextParsers.delimitedBy('}'), Map.of('{', DirectiveParsers.nestedBraces())));

    private final DirectiveParsers parsers = new DirectiveParsers();

    private static ParsedDirective parsed(Parsed<ParsedDirective> result) {
        assertThat(result.isSuccess()).as("parse result %s", result).isTrue();
        return ((Parsed.Success<ParsedDirective>) result).result();
    }

    @Test
    @DisplayName("A quoted default attribute should be parsed without quotes")
    void declaration_shouldParseQuotedDefaultAttribute() {
        // Act
        ParsedDirective directive = parsed(parsers.declaration().parse(":title \"My Doc\""));

        // Assert
        assertThat(directive).isEqualTo(new ParsedDirective("title", List.of(new Part(PartKey.attribute(), "My Doc"))));
    }

    @Test
    @DisplayName("Named attributes and a default body should be parsed in order")
    void directiveParser_shouldParseAttributesAndBody() {
        // Arrange
        Parser<String> line = TextParsers.restOfLine().map(String::trim);

        // Act
        ParsedDirective directive = parsed(parsers.directiveParser(line, false)
                .parse(":callout type=warn: some **body** text."));

        // Assert
        assertThat(directive.name()).isEqualTo("callout");
        assertThat(directive.parts()).containsExactly(
                new Part(PartKey.attribute("type"), "warn"),
                new Part(PartKey.body(), "some **body** text."));
    }

    @Test
    @DisplayName("A default attribute may be followed by named attributes")
    void declaration_shouldParseDefaultAndNamedAttributes() {
        // Act
        ParsedDirective directive = parsed(parsers.directiveParser(BRACED, false)
                .parse(":fragment sidebar id = x  width=\"1 2\"."));

        // Assert
        assertThat(directive.parts()).containsExactly(
                new Part(PartKey.attribute(), "sidebar"),
                new Part(PartKey.attribute("id"), "x"),
                new Part(PartKey.attribute("width"), "1 2"));
    }

    @Test
    @DisplayName("Escape sequences in quoted attribute values should be resolved")
    void attrValue_shouldResolveEscapes() {
        // Act
        Parsed<String> value = parsers.attrValue().parse("\"a \\\"quoted\\\" value\" rest");

        // Assert
        assertThat(((Parsed.Success<String>) value).result()).isEqualTo("a \"quoted\" value");
    }

    @Test
    @DisplayName("Named bodies should follow the default body")
    void directiveParser_shouldParseNamedBodies() {
        // Act
        ParsedDirective directive = parsed(parsers.directiveParser(BRACED, false)
                .parse(":tabs: {first} ~second: {two}\n~third:{three}"));

        // Assert
        assertThat(directive.parts()).containsExactly(
                new Part(PartKey.body(), "first"),
                new Part(PartKey.body("second"), "two"),
                new Part(PartKey.body("third"), "three"));
    }

    @Test
    @DisplayName("Only named bodies may be given")
    void directiveParser_shouldAllowNamedBodiesOnly() {
        // Act
        ParsedDirective directive = parsed(parsers.directiveParser(BRACED, false)
                .parse(":tabs: ~one: {1}"));

        // Assert
        assertThat(directive.parts()).containsExactly(new Part(PartKey.body("one"), "1"));
    }

    @Test
    @DisplayName("Braced bodies should balance nested braces")
    void bracedBody_shouldBalanceNestedBraces() {
        // Act
        Parsed<String> body = BRACED.parse(" {a {b {c}} d} rest");

        // Assert
        assertThat(((Parsed.Success<String>) body).result()).isEqualTo("a {b {c}} d");
        assertThat(body.next().offset()).isEqualTo(14);
    }

    @Test
    @DisplayName("The opening brace of a body may follow on the next line")
    void bracedBody_shouldAllowBraceOnNextLine() {
        // Act
        ParsedDirective directive = parsed(parsers.directiveParser(BRACED, false).parse(":style red:\n{ a }"));

        // Assert
        assertThat(directive.parts()).containsExactly(
                new Part(PartKey.attribute(), "red"),
                new Part(PartKey.body(), " a "));
    }

    @Test
    @DisplayName("Whitespace before the body marker should be accepted")
    void directiveParser_shouldAllowWhitespaceBeforeBodyMarker() {
        // Arrange
        Parser<String> line = TextParsers.restOfLine().map(String::trim);

        // Act
        ParsedDirective noBody = parsed(parsers.directiveParser(line, false).parse(":toc ."));
        ParsedDirective withBody = parsed(parsers.directiveParser(line, false).parse(":callout type=warn : body"));

        // Assert
        assertThat(noBody).isEqualTo(new ParsedDirective("toc", List.of()));
        assertThat(withBody.parts()).containsExactly(
                new Part(PartKey.attribute("type"), "warn"),
                new Part(PartKey.body(), "body"));
    }

    @Test
    @DisplayName("A directive without body should end with a dot")
    void directiveParser_shouldRequireTerminator() {
        // Arrange
        Parser<ParsedDirective> parser = parsers.directiveParser(BRACED, true);

        // Act & Assert
        assertThat(parsed(parser.parse("@:toc."))).isEqualTo(new ParsedDirective("toc", List.of()));
        assertThat(parser.parse("@:toc").isSuccess()).isFalse();
    }

    @Test
    @DisplayName("Names should start with a letter")
    void nameDecl_shouldStartWithLetter() {
        // Act & Assert
        assertThat(((Parsed.Success<String>) DirectiveParsers.nameDecl().parse("title-list_2 x")).result()).isEqualTo("title-list_2");
        assertThat(DirectiveParsers.nameDecl().parse("2col").isSuccess()).isFalse();
        assertThat(parsers.declaration().parse(":1abc.").isSuccess()).isFalse();
    }
}
