package org.pragmatica.sexpr.parser;

import org.pragmatica.sexpr.error.ParseError;

import java.util.Optional;
import java.util.function.Function;

/**
 * Result of parsing - either success with a value or failure with a single error.
 *
 * <p>Both variants are records, so parsing the same input twice yields equal results.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The value of a successful result.
     *
     * @throws IllegalStateException if this is a failure
     */
    T unwrap();

    Optional<ParseError> error();

    <U> ParseResult<U> map(Function<? super T, ? extends U> mapper);

    <U> ParseResult<U> flatMap(Function<? super T, ParseResult<U>> mapper);

    <R> R fold(Function<? super ParseError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    static <T> ParseResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ParseResult<T> failure(ParseError error) {
        return new Failure<>(error);
    }

    /**
     * Successful parse.
     */
    record Success<T>(T value) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.empty();
        }

        @Override
        public <U> ParseResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> ParseResult<U> flatMap(Function<? super T, ParseResult<U>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    /**
     * Failed parse - no match at the error's offset.
     */
    record Failure<T>(ParseError cause) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException("Parse failed: " + cause.message());
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.of(cause);
        }

        @Override
        public <U> ParseResult<U> map(Function<? super T, ? extends U> mapper) {
            return retype();
        }

        @Override
        public <U> ParseResult<U> flatMap(Function<? super T, ParseResult<U>> mapper) {
            return retype();
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(cause);
        }

        /**
         * The same failure, for a rule producing a different value type.
         */
        public <U> Failure<U> retype() {
            return new Failure<>(cause);
        }
    }
}
