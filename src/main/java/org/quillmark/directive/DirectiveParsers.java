package org.quillmark.directive;

import org.quillmark.parse.Pair;
import org.quillmark.parse.Parser;
import org.quillmark.parse.markup.EscapedTextParsers;
import org.quillmark.parse.markup.InlineParsers;
import org.quillmark.parse.text.Characters;
import org.quillmark.parse.text.TextParsers;
import org.quillmark.rewrite.DocumentCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

import static org.quillmark.parse.text.TextParsers.ch;

/**
 * The dialect-independent grammar of directive declarations and the engine that
 * applies a parsed directive to its registered implementation.
 * <p>
 * A declaration has the form
 * <pre>
 * :name defaultAttribute? (attrName=attrValue)* ( '.' | ':' defaultBody? (~bodyName: body)* )
 * </pre>
 * The content of a body is parsed by a parser supplied by the surrounding grammar.
 */
public class DirectiveParsers {

    private static final Logger LOG = LoggerFactory.getLogger(DirectiveParsers.class);

    private final EscapedTextParsers escapes;

    public DirectiveParsers() {
        this(new EscapedTextParsers() {});
    }

    /**
     * @param escapes The escape handling for quoted attribute values.
     */
    public DirectiveParsers(EscapedTextParsers escapes) {
        this.escapes = escapes;
    }

    /**
     * Whitespace including line breaks, possibly empty.
     */
    public static Characters wsOrNl() {
        return TextParsers.anyOf(' ', '\t', '\n');
    }

    /**
     * The name of a directive, attribute or body: a letter followed by letters,
     * digits, {@code '-'} or {@code '_'}.
     */
    public static Parser<String> nameDecl() {
        Parser<String> first = TextParsers.anyWhile(Character::isLetter).take(1);
        Parser<String> rest = TextParsers.anyWhile(c -> Character.isLetterOrDigit(c) || c == '-' || c == '_');
        return first.then(rest).map(p -> p.first() + p.second());
    }

    /**
     * An attribute value: quoted with escape sequences, or a non-empty run of characters
     * other than whitespace, {@code '.'} and {@code ':'}.
     */
    public Parser<String> attrValue() {
        Parser<String> quoted = ch('"').keepRight(escapes.escapedUntil('"'));
        Parser<String> unquoted = TextParsers.anyBut(' ', '\t', '\n', '.', ':').min(1);
        return quoted.orElse(unquoted);
    }

    private Parser<Part> defaultAttribute() {
        Parser<Void> notNamed = Parser.not(nameDecl().then(TextParsers.WS).then(ch('=')));
        return notNamed.keepRight(attrValue()).map(value -> new Part(PartKey.attribute(), value));
    }

    private Parser<Part> namedAttribute() {
        return nameDecl()
                .keepLeft(TextParsers.WS.then(ch('=')).then(TextParsers.WS))
                .then(attrValue())
                .map(p -> new Part(PartKey.attribute(p.first()), p.second()));
    }

    /**
     * Parses {@code ":" name defaultAttribute? attribute*} into a directive with
     * attribute parts only. Trailing whitespace is consumed.
     */
    public Parser<ParsedDirective> declaration() {
        Parser<Optional<Part>> defaultAttr = wsOrNl().keepRight(defaultAttribute()).opt();
        Parser<List<Part>> attrs = wsOrNl().keepRight(namedAttribute()).rep();
        return ch(':').keepRight(nameDecl())
                .then(defaultAttr)
                .then(attrs)
                .keepLeft(TextParsers.WS)
                .map(p -> {
                    List<Part> parts = new ArrayList<>();
                    p.first().second().ifPresent(parts::add);
                    parts.addAll(p.second());
                    return new ParsedDirective(p.first().first(), parts);
                });
    }

    /**
     * Parses a complete directive with its body parts.
     *
     * @param bodyContent The parser for the content of a single body.
     * @param includeStartChar Whether the declaration starts with {@code '@'}.
     * @return The parser for the directive.
     */
    public Parser<ParsedDirective> directiveParser(Parser<String> bodyContent, boolean includeStartChar) {
        Parser<Void> notNamedBody = Parser.not(namedBodyStart());
        Parser<Part> defaultBody = notNamedBody.keepRight(bodyContent).map(content -> new Part(PartKey.body(), content));
        Parser<Part> namedBody = namedBodyStart().then(bodyContent)
                .map(p -> new Part(PartKey.body(p.first()), p.second()));

        Parser<List<Part>> noBody = ch('.').as(List.<Part>of());
        Parser<List<Part>> bodies = ch(':').keepRight(defaultBody.opt().then(namedBody.rep()))
                .map(p -> {
                    List<Part> parts = new ArrayList<>();
                    p.first().ifPresent(parts::add);
                    parts.addAll(p.second());
                    return parts;
                });

        Parser<ParsedDirective> directive = declaration().then(noBody.orElse(bodies))
                .map(p -> {
                    List<Part> parts = new ArrayList<>(p.first().parts());
                    parts.addAll(p.second());
                    return new ParsedDirective(p.first().name(), parts);
                });
        return includeStartChar ? ch('@').keepRight(directive) : directive;
    }

    private Parser<String> namedBodyStart() {
        return wsOrNl().then(ch('~')).keepRight(nameDecl()).keepLeft(TextParsers.WS.then(ch(':')));
    }

    /**
     * Parses the remainder of a brace-delimited construct after its opening brace,
     * producing the literal text including both braces. Nested braces are balanced.
     */
    public static Parser<String> nestedBraces() {
        return Parser.lazy(() -> InlineParsers.text(TextParsers.delimitedBy('}'), braceContent())
                .map(text -> "{" + text + "}"));
    }

    /**
     * Parses a body enclosed in braces, keeping its raw source. The opening brace may
     * follow on the next line.
     *
     * @param content The parser for the content after the opening brace. It must consume
     *                the closing brace and nothing after it.
     * @return The parser producing the source between the braces.
     */
    public static Parser<String> bracedBody(Parser<?> content) {
        return wsOrNl().then(ch('{'))
                .keepRight(content.withSource())
                .map(p -> p.second().substring(0, p.second().length() - 1));
    }

    private static Map<Character, Parser<String>> braceContent() {
        Parser<String> escape = TextParsers.anyChar().map(c -> "\\" + c);
        return Map.of('{', nestedBraces(), '\\', escape);
    }

    /**
     * Applies a parsed directive to its implementation.
     * <p>
     * Unknown names and duplicate parts are reported together. All failures, including
     * those of the directive itself, are turned into an invalid element, so the
     * surrounding document never fails because of a directive. Directives that
     * require the document tree are wrapped in a placeholder.
     *
     * @param registry The directives of the matching kind.
     * @param parsed The parsed directive.
     * @param contextFactory Creates the context from the part map and the optional cursor.
     * @param placeholderFactory Wraps a deferred resolver in a placeholder element.
     * @param invalidFactory Creates an invalid element from an error message.
     * @param kindLabel The kind of directive used in messages, e.g. {@code span}.
     * @param <E> The element type.
     * @param <C> The context type.
     * @return The final element, a placeholder or an invalid element.
     */
    public static <E, C extends DirectiveContext> E applyDirective(
            DirectiveRegistry<? extends IDirective<E, C>> registry,
            ParsedDirective parsed,
            BiFunction<Map<PartKey, String>, Optional<DocumentCursor>, C> contextFactory,
            Function<Function<DocumentCursor, E>, E> placeholderFactory,
            Function<String, E> invalidFactory,
            String kindLabel) {

        DirectiveResult<IDirective<E, C>> directive = registry.get(parsed.name())
                .<DirectiveResult<IDirective<E, C>>>map(DirectiveResult::success)
                .orElseGet(() -> DirectiveResult.failure("No " + kindLabel + " directive registered with name: " + parsed.name()));

        DirectiveResult<Pair<IDirective<E, C>, Map<PartKey, String>>> validated =
                directive.combine(partMap(parsed.parts()), Pair::new);

        if (!(validated instanceof DirectiveResult.Success<Pair<IDirective<E, C>, Map<PartKey, String>>> success)) {
            LOG.debug("Invalid {} directive '{}'", kindLabel, parsed.name());
            List<String> messages = ((DirectiveResult.Failure<?>) validated).messages();
            return collapse(parsed, DirectiveResult.failure(messages), invalidFactory);
        }

        IDirective<E, C> impl = success.value().first();
        Map<PartKey, String> parts = success.value().second();
        if (impl.requiresContext()) {
            LOG.debug("Deferring {} directive '{}' until the document tree is assembled", kindLabel, parsed.name());
            return placeholderFactory.apply(
                    cursor -> collapse(parsed, impl.apply(contextFactory.apply(parts, Optional.of(cursor))), invalidFactory));
        }
        LOG.debug("Applying {} directive '{}'", kindLabel, parsed.name());
        return collapse(parsed, impl.apply(contextFactory.apply(parts, Optional.empty())), invalidFactory);
    }

    /**
     * Builds the part map, reporting every duplicated key exactly once in first-seen order.
     */
    static DirectiveResult<Map<PartKey, String>> partMap(List<Part> parts) {
        Map<PartKey, String> map = new LinkedHashMap<>();
        Set<PartKey> duplicates = new LinkedHashSet<>();
        for (Part part : parts) {
            if (map.containsKey(part.key())) {
                duplicates.add(part.key());
            } else {
                map.put(part.key(), part.content());
            }
        }
        if (duplicates.isEmpty()) {
            return DirectiveResult.success(map);
        }
        return DirectiveResult.failure(duplicates.stream().map(key -> "Duplicate " + key.description()).toList());
    }

    private static <E> E collapse(ParsedDirective parsed, DirectiveResult<E> result, Function<String, E> invalidFactory) {
        if (result instanceof DirectiveResult.Success<E> success) {
            return success.value();
        }
        List<String> messages = ((DirectiveResult.Failure<E>) result).messages();
        return invalidFactory.apply("One or more errors processing directive '" + parsed.name() + "': " + String.join(", ", messages));
    }
}
