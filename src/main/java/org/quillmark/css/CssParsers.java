package org.quillmark.css;

import org.quillmark.parse.Pair;
import org.quillmark.parse.Parsed;
import org.quillmark.parse.Parser;
import org.quillmark.parse.ParserContext;
import org.quillmark.parse.markup.InlineParsers;
import org.quillmark.parse.text.Characters;
import org.quillmark.parse.text.TextParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.quillmark.parse.text.TextParsers.ch;
import static org.quillmark.parse.text.TextParsers.literal;

/**
 * Parses the subset of CSS used for styling documents: type, id and style name
 * selectors, descendant and child combinators, selector groups and style declarations.
 * Attribute selectors, pseudo classes, namespaces and media queries are not supported.
 */
public class CssParsers {

    private static final Logger LOG = LoggerFactory.getLogger(CssParsers.class);

    private static final Characters WS = TextParsers.WS;
    private static final Characters WS_OR_NL = TextParsers.WS_OR_NL;

    private enum Combinator { DESCENDANT, CHILD }

    private record Style(String name, String value) {}

    private final Parser<List<StyleDeclaration>> styleSheet = createStyleSheetParser();

    /**
     * The name of a style or selector: a letter, followed by letters and digits with
     * single {@code '-'} or {@code '_'} symbols between them.
     */
    static Parser<String> styleRefName() {
        Parser<String> alpha = TextParsers.anyWhile(Character::isLetter).min(1);
        Parser<String> alphaNum = TextParsers.anyWhile(Character::isLetterOrDigit).min(1);
        Parser<String> symbol = TextParsers.anyOf('-', '_').max(1);
        return alpha.then(symbol.then(alphaNum).map(p -> p.first() + p.second()).rep())
                .map(p -> p.first() + String.join("", p.second()));
    }

    private static Parser<Combinator> combinator() {
        Parser<Combinator> child = WS.then(ch('>')).then(WS).as(Combinator.CHILD);
        Parser<Combinator> descendant = WS.min(1).as(Combinator.DESCENDANT);
        return child.orElse(descendant);
    }

    private static Parser<StylePredicate> predicate() {
        Parser<StylePredicate> id = ch('#').keepRight(styleRefName()).map(StylePredicate.Id::new);
        Parser<StylePredicate> styleName = ch('.').keepRight(styleRefName()).map(StylePredicate.StyleName::new);
        return id.orElse(styleName);
    }

    /**
     * A selector without combinators, e.g. {@code Paragraph#title.intro}.
     */
    static Parser<Selector> simpleSelectorSequence() {
        Parser<List<StylePredicate>> typeSelector = styleRefName()
                .<List<StylePredicate>>map(name -> List.of(new StylePredicate.ElementType(name)))
                .orElse(ch('*').as(List.<StylePredicate>of()));
        Parser<List<StylePredicate>> withType = typeSelector.then(predicate().rep()).map(p -> {
            List<StylePredicate> all = new ArrayList<>(p.first());
            all.addAll(p.second());
            return all;
        });
        return withType.orElse(predicate().rep1()).map(predicates -> new Selector(new HashSet<>(predicates)));
    }

    /**
     * A selector with combinators, e.g. {@code Callout > Paragraph .note}.
     */
    static Parser<Selector> selector() {
        return simpleSelectorSequence().then(combinator().then(simpleSelectorSequence()).rep()).map(p -> {
            Selector result = p.first();
            for (Pair<Combinator, Selector> next : p.second()) {
                boolean immediate = next.first() == Combinator.CHILD;
                result = next.second().withParent(new ParentSelector(result, immediate));
            }
            return result;
        });
    }

    static Parser<List<Selector>> selectorGroup() {
        Parser<Selector> next = WS.then(ch(',')).then(WS).keepRight(selector());
        return selector().then(next.rep()).map(p -> {
            List<Selector> all = new ArrayList<>();
            all.add(p.first());
            all.addAll(p.second());
            return all;
        });
    }

    /**
     * The value of a style up to the terminating {@code ';'}, with comments removed.
     */
    static Parser<String> styleValue() {
        Parser<String> comment = ch('*').then(TextParsers.delimitedBy("*/")).then(WS_OR_NL).as("");
        return InlineParsers.text(TextParsers.delimitedBy(';'), Map.of('/', comment)).map(String::strip);
    }

    private static Parser<Style> style() {
        return styleRefName().keepLeft(WS.then(ch(':')).then(WS))
                .then(styleValue().keepLeft(WS_OR_NL))
                .map(p -> new Style(p.first(), p.second()));
    }

    private static Parser<String> comment() {
        return literal("/*").then(TextParsers.delimitedBy("*/")).then(WS_OR_NL).as("");
    }

    private static Parser<List<StyleDeclaration>> styleDeclarations() {
        Parser<Style> styleOrComment = comment().rep().keepRight(style());
        Parser<List<Style>> body = styleOrComment.rep().keepLeft(comment().rep());
        return selectorGroup()
                .keepLeft(WS_OR_NL.then(ch('{')).then(WS_OR_NL))
                .then(body)
                .keepLeft(WS_OR_NL.then(ch('}')))
                .map(p -> {
                    Map<String, String> styles = new LinkedHashMap<>();
                    for (Style style : p.second()) {
                        styles.put(style.name(), style.value());
                    }
                    return p.first().stream().map(selector -> new StyleDeclaration(selector, styles)).toList();
                });
    }

    private static Parser<List<StyleDeclaration>> createStyleSheetParser() {
        Parser<?> filler = WS_OR_NL.then(comment().rep()).then(WS_OR_NL);
        return filler.keepRight(styleDeclarations()).rep().keepLeft(filler).map(groups -> {
            List<StyleDeclaration> result = new ArrayList<>();
            for (List<StyleDeclaration> group : groups) {
                for (StyleDeclaration declaration : group) {
                    result.add(declaration.increaseOrderBy(result.size()));
                }
            }
            return result;
        });
    }

    /**
     * Parses a complete style sheet.
     *
     * @param path The path the style sheet was read from, used in error messages.
     * @param source The style sheet source.
     * @return All declarations of the style sheet.
     * @throws StyleSheetParseException if any part of the input is not valid.
     */
    public StyleDeclarationSet parseStyleSheet(String path, String source) throws StyleSheetParseException {
        ParserContext in = ParserContext.of(source.replace("\r\n", "\n"));
        Parsed<List<StyleDeclaration>> parsed = styleSheet.parse(in);
        if (parsed instanceof Parsed.Success<List<StyleDeclaration>> success && success.next().atEnd()) {
            LOG.debug("Parsed {} style declarations from {}", success.result().size(), path);
            return new StyleDeclarationSet(path, success.result());
        }
        // Re-run the failing declaration to report why it did not match
        Parsed<List<StyleDeclaration>> failure = styleDeclarations().parse(parsed.next());
        if (failure instanceof Parsed.Failure<List<StyleDeclaration>> f) {
            throw new StyleSheetParseException(f.message(), path, f.next().position());
        }
        throw new StyleSheetParseException("Unexpected input", path, parsed.next().position());
    }
}
