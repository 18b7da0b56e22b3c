package org.quillmark.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A parser over a {@link ParserContext}. Parsers are stateless and may be shared
 * between threads; all state of a parse lives in the contexts and results.
 * <p>
 * The default methods provide the combinators the markup and directive grammars
 * are built from: sequencing, alternation, repetition, optionality, negative
 * lookahead and mapping.
 *
 * @param <T> The type of the produced result.
 */
@FunctionalInterface
public interface Parser<T> {

    /**
     * Applies this parser at the given context.
     * @param in The context to start at.
     * @return The outcome of this parser.
     */
    Parsed<T> parse(ParserContext in);

    /**
     * Applies this parser at the start of the given input.
     * @param input The input string.
     * @return The outcome of this parser.
     */
    default Parsed<T> parse(String input) {
        return parse(ParserContext.of(input));
    }

    default <U> Parser<U> map(Function<? super T, ? extends U> f) {
        return in -> parse(in).map(f);
    }

    default <U> Parser<U> as(U value) {
        return map(ignored -> value);
    }

    /**
     * Rejects results that do not satisfy the predicate.
     * @param predicate The condition for a result to be accepted.
     * @param message The failure message for rejected results.
     * @return The filtered parser.
     */
    default Parser<T> filter(Predicate<? super T> predicate, String message) {
        return in -> {
            Parsed<T> result = parse(in);
            if (result instanceof Parsed.Success<T> success && !predicate.test(success.result())) {
                return new Parsed.Failure<>(message, in);
            }
            return result;
        };
    }

    /**
     * Applies the given parser after this one and pairs both results.
     */
    default <U> Parser<Pair<T, U>> then(Parser<U> next) {
        return in -> {
            Parsed<T> first = parse(in);
            if (!(first instanceof Parsed.Success<T> s1)) return ((Parsed.Failure<T>) first).cast();
            Parsed<U> second = next.parse(s1.next());
            if (!(second instanceof Parsed.Success<U> s2)) return ((Parsed.Failure<U>) second).cast();
            return new Parsed.Success<>(new Pair<>(s1.result(), s2.result()), s2.next());
        };
    }

    /**
     * Applies the given parser after this one and keeps the result of this one.
     */
    default <U> Parser<T> keepLeft(Parser<U> next) {
        return then(next).map(Pair::first);
    }

    /**
     * Applies the given parser after this one and keeps the result of the given one.
     */
    default <U> Parser<U> keepRight(Parser<U> next) {
        return then(next).map(Pair::second);
    }

    /**
     * Tries the alternative at the original position if this parser fails.
     * When both fail, the failure that got further into the input is reported.
     */
    default Parser<T> orElse(Parser<? extends T> alternative) {
        return in -> {
            Parsed<T> first = parse(in);
            if (first.isSuccess()) return first;
            Parsed<T> second = Parsed.widen(alternative.parse(in));
            if (second.isSuccess()) return second;
            return first.next().offset() > second.next().offset() ? first : second;
        };
    }

    /**
     * Applies this parser zero or more times. Repetition stops at the first failure
     * or at the first success that does not consume any input.
     */
    default Parser<List<T>> rep() {
        return in -> {
            List<T> results = new ArrayList<>();
            ParserContext current = in;
            while (true) {
                Parsed<T> result = parse(current);
                if (!(result instanceof Parsed.Success<T> success)) break;
                results.add(success.result());
                if (success.next().offset() == current.offset()) break;
                current = success.next();
            }
            return new Parsed.Success<>(Collections.unmodifiableList(results), current);
        };
    }

    /**
     * Applies this parser one or more times.
     */
    default Parser<List<T>> rep1() {
        return rep().filter(list -> !list.isEmpty(), "Expected at least one occurrence");
    }

    default Parser<Optional<T>> opt() {
        return in -> {
            Parsed<T> result = parse(in);
            if (result instanceof Parsed.Success<T> success) {
                return new Parsed.Success<>(Optional.ofNullable(success.result()), success.next());
            }
            return new Parsed.Success<>(Optional.empty(), in);
        };
    }

    /**
     * Pairs the result of this parser with the source text it consumed.
     */
    default Parser<Pair<T, String>> withSource() {
        return in -> {
            Parsed<T> result = parse(in);
            if (!(result instanceof Parsed.Success<T> success)) return ((Parsed.Failure<T>) result).cast();
            String source = in.capture(success.next().offset() - in.offset());
            return new Parsed.Success<>(new Pair<>(success.result(), source), success.next());
        };
    }

    /**
     * Negative lookahead: succeeds without consuming input if the given parser fails.
     * @param parser The parser that must not match.
     * @return A parser producing {@code null} on success.
     */
    static Parser<Void> not(Parser<?> parser) {
        return in -> {
            if (parser.parse(in).isSuccess()) return new Parsed.Failure<>("Unexpected input", in);
            return new Parsed.Success<>(null, in);
        };
    }

    static <T> Parser<T> success(T value) {
        return in -> new Parsed.Success<>(value, in);
    }

    static <T> Parser<T> failure(String message) {
        return in -> new Parsed.Failure<>(message, in);
    }

    /**
     * Succeeds only at the end of the input.
     */
    static Parser<Void> eof() {
        return in -> {
            if (in.atEnd()) return new Parsed.Success<>(null, in);
            return new Parsed.Failure<>("Expected end of input", in);
        };
    }

    /**
     * Defers the construction of a parser until its first use, which allows
     * recursive grammars. The supplier is evaluated at most once.
     */
    static <T> Parser<T> lazy(Supplier<? extends Parser<T>> supplier) {
        return new Parser<>() {
            private volatile Parser<T> delegate;

            @Override
            public Parsed<T> parse(ParserContext in) {
                Parser<T> p = delegate;
                if (p == null) {
                    p = supplier.get();
                    delegate = p;
                }
                return p.parse(in);
            }
        };
    }
}
