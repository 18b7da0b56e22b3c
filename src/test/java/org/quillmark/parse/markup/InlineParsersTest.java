package org.quillmark.parse.markup;

import org.quillmark.parse.Parsed;
import org.quillmark.parse.Parser;
import org.quillmark.parse.text.TextDelimiter;
import org.quillmark.parse.text.TextParsers;
import org.quillmark.tree.Emphasized;
import org.quillmark.tree.Literal;
import org.quillmark.tree.MarkupContextReference;
import org.quillmark.tree.Span;
import org.quillmark.tree.Text;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class InlineParsersTest {

    private static final Map<Character, Parser<Span>> REF = Map.of('{',
            TextParsers.delimitedBy(TextDelimiter.of('}').nonEmpty()).map(MarkupContextReference::new));

    private static List<Span> spans(String input, Map<Character, Parser<Span>> parsers) {
        Parsed<List<Span>> parsed = InlineParsers.spans(TextParsers.untilEnd(), parsers).parse(input);
        assertThat(parsed.isSuccess()).as("parse result %s", parsed).isTrue();
        return ((Parsed.Success<List<Span>>) parsed).result();
    }

    @Test
    @DisplayName("A trigger character should hand over to its nested parser")
    void shouldDispatchToNestedParser() {
        // Act
        List<Span> result = spans("a{b}c", REF);

        // Assert
        assertThat(result).containsExactly(new Text("a"), new MarkupContextReference("b"), new Text("c"));
    }

    @Test
    @DisplayName("A failing nested parser should leave its trigger as literal text")
    void shouldKeepTriggerOfFailedParserAsText() {
        // Act
        List<Span> result = spans("a{bc", REF);

        // Assert
        assertThat(result).containsExactly(new Text("a{bc"));
    }

    @Test
    @DisplayName("Text of a result without nested elements should equal the input")
    void shouldPreserveContent() {
        // Arrange
        String input = "a{ b{{c{";

        // Act
        List<Span> result = spans(input, REF);

        // Assert
        assertThat(result).hasSize(1);
        assertThat(((Text) result.get(0)).content()).isEqualTo(input);
    }

    @ParameterizedTest
    @ValueSource(strings = {"a{b}c{d{e", "a{b}c{d{e}f{", "{x}{y}", "{{}"})
    @DisplayName("Literal text and the source of nested elements should add up to the input")
    void shouldPreserveContentWithNestedElements(String input) {
        // Arrange
        Parser<Span> withSource = TextParsers.delimitedBy(TextDelimiter.of('}').nonEmpty())
                .withSource()
                .map(parsed -> new Literal("{" + parsed.second()));

        // Act
        List<Span> result = spans(input, Map.of('{', withSource));

        // Assert
        String restored = result.stream()
                .map(span -> span instanceof Literal literal ? literal.content() : ((Text) span).content())
                .collect(Collectors.joining());
        assertThat(restored).isEqualTo(input);
        assertThat(result).hasAtLeastOneElementOfType(Literal.class);
    }

    @Test
    @DisplayName("The end delimiter should take precedence over nested triggers")
    void endDelimiterShouldTakePrecedence() {
        // Arrange
        Parser<Span> emphasis = TextParsers.delimitedBy('*').map(text -> new Emphasized(List.of(new Text(text))));
        Parser<List<Span>> parser = InlineParsers.spans(TextParsers.delimitedBy('*', ']'), Map.of('*', emphasis, ']', emphasis));

        // Act
        Parsed<List<Span>> parsed = parser.parse("ab]cd");

        // Assert
        assertThat(((Parsed.Success<List<Span>>) parsed).result()).containsExactly(new Text("ab"));
        assertThat(parsed.next().offset()).isEqualTo(3);
    }

    @Test
    @DisplayName("A missing end delimiter should fail the inline parser")
    void shouldFailWithoutEndDelimiter() {
        // Act
        Parsed<List<Span>> parsed = InlineParsers.spans(TextParsers.delimitedBy(']'), REF).parse("a{b}c");

        // Assert
        assertThat(parsed.isSuccess()).isFalse();
    }

    @Test
    @DisplayName("text should concatenate the output of nested parsers")
    void text_shouldApplyEscapes() {
        // Arrange
        Parser<String> quoted = InlineParsers.text(TextParsers.delimitedBy('"'), Map.of('\\', TextParsers.anyChar()));

        // Act
        Parsed<String> parsed = quoted.parse("a\\\"b\\\\c\" rest");

        // Assert
        assertThat(((Parsed.Success<String>) parsed).result()).isEqualTo("a\"b\\c");
        assertThat(parsed.next().offset()).isEqualTo(8);
    }
}
