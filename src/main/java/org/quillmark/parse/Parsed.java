package org.quillmark.parse;

import java.util.function.Function;

/**
 * The outcome of a single parser invocation: either a result together with the
 * context after the consumed input, or a message together with the context where
 * the parser gave up.
 *
 * @param <T> The type of the result.
 */
public sealed interface Parsed<T> permits Parsed.Success, Parsed.Failure {

    /**
     * @return The context after a success, or the context where a failure occurred.
     */
    ParserContext next();

    /**
     * @return true for a {@link Success}.
     */
    boolean isSuccess();

    /**
     * Transforms the result of a success, leaving failures untouched.
     * @param f The function to apply.
     * @param <U> The new result type.
     * @return The transformed outcome.
     */
    <U> Parsed<U> map(Function<? super T, ? extends U> f);

    /**
     * Widens an outcome of a subtype. Outcomes are immutable, so this is safe.
     */
    @SuppressWarnings("unchecked")
    static <T> Parsed<T> widen(Parsed<? extends T> parsed) {
        return (Parsed<T>) parsed;
    }

    /**
     * A successful outcome.
     * @param result The produced value.
     * @param next The context after the consumed input.
     */
    record Success<T>(T result, ParserContext next) implements Parsed<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <U> Parsed<U> map(Function<? super T, ? extends U> f) {
            return new Success<>(f.apply(result), next);
        }
    }

    /**
     * A failed outcome.
     * @param message The reason of the failure.
     * @param next The context where the failure occurred.
     */
    record Failure<T>(String message, ParserContext next) implements Parsed<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <U> Parsed<U> map(Function<? super T, ? extends U> f) {
            return cast();
        }

        /**
         * @return This failure retyped for a different result type.
         */
        public <U> Failure<U> cast() {
            return new Failure<>(message, next);
        }

        @Override
        public String toString() {
            return next.position() + " failure: " + message;
        }
    }
}
