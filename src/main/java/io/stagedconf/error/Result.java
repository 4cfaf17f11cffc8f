package io.stagedconf.error;

import java.util.Objects;

/**
 * Outcome of one pipeline stage: either a value or the failure that stopped the pipeline.
 *
 * @param <T> value type
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    static <T> Result<T> ok(final T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(final ConfigObjectException failure) {
        return new Err<>(failure);
    }

    /**
     * Runs a stage that may throw a pipeline failure.
     */
    static <T> Result<T> of(final Stage<T> stage) {
        try {
            return ok(stage.run());
        } catch (final ConfigObjectException e) {
            return err(e);
        }
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default <R> Result<R> flatMap(final Step<? super T, R> next) {
        if (this instanceof Ok<T> ok) {
            try {
                return ok(next.apply(ok.value()));
            } catch (final ConfigObjectException e) {
                return err(e);
            }
        }
        return err(((Err<T>) this).failure());
    }

    /**
     * Returns the value or throws the recorded failure.
     */
    default T orElseThrow() throws ConfigObjectException {
        if (this instanceof Ok<T> ok) return ok.value();
        throw ((Err<T>) this).failure();
    }

    record Ok<T>(T value) implements Result<T> {
    }

    record Err<T>(ConfigObjectException failure) implements Result<T> {
        public Err {
            Objects.requireNonNull(failure, "failure");
        }
    }

    @FunctionalInterface
    interface Stage<T> {
        T run() throws ConfigObjectException;
    }

    @FunctionalInterface
    interface Step<T, R> {
        R apply(T value) throws ConfigObjectException;
    }
}
