package com.ivamare.eventdispatch.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Success/failure payload that carries a value on success.
 *
 * <p>Handlers may return it to share the same type with other callers;
 * the dispatcher keeps only success or failure.
 *
 * @param <T> success value type
 */
public final class ValueOutcome<T> implements Result {

    private final T value;
    private final HandlerError error;

    private ValueOutcome(T value, HandlerError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ValueOutcome<T> success(T value) {
        return new ValueOutcome<>(value, null);
    }

    public static <T> ValueOutcome<T> failure(HandlerError error) {
        return new ValueOutcome<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> ValueOutcome<T> failure(String message) {
        return failure(HandlerError.of(message));
    }

    @Override
    public boolean isSuccess() {
        return error == null;
    }

    @Override
    public Optional<HandlerError> error() {
        return Optional.ofNullable(error);
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValueOutcome<?> other)) {
            return false;
        }
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "ValueOutcome[success=" + value + "]" : "ValueOutcome[failure=" + error + "]";
    }
}
