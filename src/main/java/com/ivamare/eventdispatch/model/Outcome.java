package com.ivamare.eventdispatch.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Uniform result every handler is coerced to.
 *
 * <p>A handler may also return it directly. A failed outcome always carries a {@link HandlerError}.
 */
public final class Outcome implements Result {

    private static final Outcome SUCCESS = new Outcome(null);

    private final HandlerError error;

    private Outcome(HandlerError error) {
        this.error = error;
    }

    public static Outcome success() {
        return SUCCESS;
    }

    public static Outcome failure(HandlerError error) {
        return new Outcome(Objects.requireNonNull(error, "error"));
    }

    /**
     * Failure with the default failure code.
     */
    public static Outcome failure(String message) {
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

    @Override
    public Outcome toOutcome() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Outcome other)) {
            return false;
        }
        return Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Outcome[success]" : "Outcome[failure=" + error + "]";
    }
}
