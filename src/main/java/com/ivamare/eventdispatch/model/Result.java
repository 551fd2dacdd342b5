package com.ivamare.eventdispatch.model;

import java.util.Optional;

/**
 * A success/failure payload a handler may return.
 *
 * <p>Any value carried alongside a success is ignored by the dispatcher; only
 * {@link #isSuccess()} and {@link #error()} cross the invoker boundary.
 */
public interface Result {

    boolean isSuccess();

    /**
     * @return the failure detail, empty on success
     */
    Optional<HandlerError> error();

    /**
     * Reduce this result to an {@link Outcome}, discarding any success value.
     */
    default Outcome toOutcome() {
        return isSuccess() ? Outcome.success() : Outcome.failure(error().orElseThrow());
    }
}
