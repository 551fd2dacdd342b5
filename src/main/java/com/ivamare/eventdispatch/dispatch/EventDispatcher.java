package com.ivamare.eventdispatch.dispatch;

import com.ivamare.eventdispatch.model.AggregateOutcome;
import com.ivamare.eventdispatch.model.CancellationToken;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point the event transport feeds events into.
 *
 * <p>Every handler registered for the event's exact type runs, one after another in
 * registration order. Handler failures and faults never propagate; callers must
 * inspect the returned outcome.
 */
public interface EventDispatcher {

    /**
     * Create a builder for standalone (non-Spring) use.
     *
     * @return a new dispatcher builder
     */
    static EventDispatcherBuilder builder() {
        return new EventDispatcherBuilder();
    }

    /**
     * Dispatch an event asynchronously.
     *
     * @param event The event
     * @param token Advisory cancellation token handed to handlers that declare one
     * @return future completing with the aggregate outcome; never completes exceptionally
     * @throws IllegalArgumentException if event is null
     * @throws com.ivamare.eventdispatch.exception.InvalidOperationException if the
     *         dispatch table has not been built yet
     */
    CompletableFuture<AggregateOutcome> dispatchAsync(Object event, CancellationToken token);

    /**
     * Dispatch an event and wait for every handler to finish.
     *
     * @param event The event
     * @param token Advisory cancellation token handed to handlers that declare one
     * @return the aggregate outcome
     */
    default AggregateOutcome dispatch(Object event, CancellationToken token) {
        return dispatchAsync(event, token).join();
    }

    /**
     * Dispatch an event with {@link CancellationToken#NONE}.
     *
     * @param event The event
     * @return the aggregate outcome
     */
    default AggregateOutcome dispatch(Object event) {
        return dispatch(event, CancellationToken.NONE);
    }
}
