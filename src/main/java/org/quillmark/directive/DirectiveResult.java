package org.quillmark.directive;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * The outcome of processing a directive: a value or a list of error messages.
 *
 * @param <T> The type of the value.
 */
public sealed interface DirectiveResult<T> permits DirectiveResult.Success, DirectiveResult.Failure {

    static <T> DirectiveResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> DirectiveResult<T> failure(String message) {
        return new Failure<>(List.of(message));
    }

    static <T> DirectiveResult<T> failure(List<String> messages) {
        return new Failure<>(messages);
    }

    <U> DirectiveResult<U> map(Function<? super T, ? extends U> f);

    <U> DirectiveResult<U> flatMap(Function<? super T, DirectiveResult<U>> f);

    /**
     * Combines two results. If either side failed, the messages of both sides are
     * collected in order, this side first.
     */
    default <U, R> DirectiveResult<R> combine(DirectiveResult<U> other, BiFunction<? super T, ? super U, ? extends R> f) {
        if (this instanceof Success<T> s1 && other instanceof Success<U> s2) {
            return new Success<>(f.apply(s1.value(), s2.value()));
        }
        List<String> messages = new ArrayList<>();
        if (this instanceof Failure<T> f1) messages.addAll(f1.messages());
        if (other instanceof Failure<U> f2) messages.addAll(f2.messages());
        return new Failure<>(messages);
    }

    record Success<T>(T value) implements DirectiveResult<T> {
        @Override
        public <U> DirectiveResult<U> map(Function<? super T, ? extends U> f) {
            return new Success<>(f.apply(value));
        }

        @Override
        public <U> DirectiveResult<U> flatMap(Function<? super T, DirectiveResult<U>> f) {
            return f.apply(value);
        }
    }

    /**
     * @param messages The error messages, never empty.
     */
    record Failure<T>(List<String> messages) implements DirectiveResult<T> {

        public Failure {
            if (messages.isEmpty()) throw new IllegalArgumentException("A failure needs at least one message");
            messages = List.copyOf(messages);
        }

        @Override
        public <U> DirectiveResult<U> map(Function<? super T, ? extends U> f) {
            return new Failure<>(messages);
        }

        @Override
        public <U> DirectiveResult<U> flatMap(Function<? super T, DirectiveResult<U>> f) {
            return new Failure<>(messages);
        }
    }
}
