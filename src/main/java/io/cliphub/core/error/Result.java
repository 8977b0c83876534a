package io.cliphub.core.error;

import java.util.Objects;

/**
 * Outcome of an operation that can fail with a {@link HubError}.
 * <p>
 * Callers branch on {@link #isOk()} rather than catching exceptions across component boundaries.
 *
 * @param <T> the success value type
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    static <T> Result<T> ok(final T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(final HubError error) {
        return new Err<>(error);
    }

    static <T> Result<T> err(final ErrorKind kind, final String message) {
        return new Err<>(HubError.of(kind, message));
    }

    boolean isOk();

    /**
     * @throws IllegalStateException when this is an {@link Err}
     */
    T value();

    /**
     * @throws IllegalStateException when this is an {@link Ok}
     */
    HubError error();

    record Ok<T>(T value) implements Result<T> {
        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public HubError error() {
            throw new IllegalStateException("Ok has no error");
        }
    }

    record Err<T>(HubError error) implements Result<T> {
        public Err {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Err has no value: " + error.message());
        }
    }
}
