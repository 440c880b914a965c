package com.xpdustry.roster.common.functional;

import java.util.Objects;
import java.util.function.Function;

public sealed interface RosterResult<V, E> {

    static <V, E> RosterResult<V, E> success(final V value) {
        return new Success<>(value);
    }

    static <V, E> RosterResult<V, E> failure(final E error) {
        return new Failure<>(error);
    }

    V value();

    E error();

    boolean isSuccess();

    default boolean isFailure() {
        return !this.isSuccess();
    }

    <R> RosterResult<R, E> map(final Function<? super V, ? extends R> mapper);

    <R> RosterResult<R, E> flatMap(final Function<? super V, RosterResult<R, E>> mapper);

    <X extends Throwable> V orElseThrow(final Function<? super E, ? extends X> exception) throws X;

    record Success<V, E>(V value) implements RosterResult<V, E> {

        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public E error() {
            throw new NullPointerException("This success has no error");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> RosterResult<R, E> map(final Function<? super V, ? extends R> mapper) {
            return new Success<>(mapper.apply(this.value));
        }

        @Override
        public <R> RosterResult<R, E> flatMap(final Function<? super V, RosterResult<R, E>> mapper) {
            return mapper.apply(this.value);
        }

        @Override
        public <X extends Throwable> V orElseThrow(final Function<? super E, ? extends X> exception) {
            return this.value;
        }
    }

    record Failure<V, E>(E error) implements RosterResult<V, E> {

        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public V value() {
            throw new NullPointerException("This failure has no value");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <R> RosterResult<R, E> map(final Function<? super V, ? extends R> mapper) {
            return new Failure<>(this.error);
        }

        @Override
        public <R> RosterResult<R, E> flatMap(final Function<? super V, RosterResult<R, E>> mapper) {
            return new Failure<>(this.error);
        }

        @Override
        public <X extends Throwable> V orElseThrow(final Function<? super E, ? extends X> exception) throws X {
            throw exception.apply(this.error);
        }
    }
}
