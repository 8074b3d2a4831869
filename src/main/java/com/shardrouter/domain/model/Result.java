package com.shardrouter.domain.model;

import java.util.function.Function;

/**
 * A sealed type representing the outcome of an operation that can either succeed or fail.
 * Used for expected validation outcomes (user or configuration input) instead of exceptions.
 *
 * @param <T> the type of the success value
 * @param <E> the type of the error
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    record Success<T, E>(T value) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public <X extends RuntimeException> T getOrThrow(Function<? super E, X> exceptionMapper) {
            return value;
        }

        @Override
        public E errorOrNull() {
            return null;
        }
    }

    record Failure<T, E>(E error) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            throw new IllegalStateException("Cannot get value from Failure: " + error);
        }

        @Override
        public <X extends RuntimeException> T getOrThrow(Function<? super E, X> exceptionMapper) {
            throw exceptionMapper.apply(error);
        }

        @Override
        public E errorOrNull() {
            return error;
        }
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    T getOrThrow();

    /**
     * Returns the value, or throws the exception produced from the error.
     * Used where a failed parse is fatal, e.g. while loading the topology at startup.
     */
    <X extends RuntimeException> T getOrThrow(Function<? super E, X> exceptionMapper);

    E errorOrNull();

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }
}
