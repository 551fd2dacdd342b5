package com.ivamare.eventdispatch.model;

import java.util.List;

/**
 * Combined result of running every handler matched for one dispatched event.
 *
 * @param success true iff {@code failures} is empty
 * @param failures Failure payloads in handler execution order
 */
public record AggregateOutcome(
    boolean success,
    List<HandlerError> failures
) {
    private static final AggregateOutcome EMPTY = new AggregateOutcome(true, List.of());

    public AggregateOutcome {
        failures = failures != null ? List.copyOf(failures) : List.of();
        if (success != failures.isEmpty()) {
            throw new IllegalArgumentException("success must be true iff there are no failures");
        }
    }

    /**
     * Outcome of a dispatch that ran no handlers, or where every handler succeeded.
     */
    public static AggregateOutcome empty() {
        return EMPTY;
    }

    public static AggregateOutcome of(List<HandlerError> failures) {
        return failures.isEmpty() ? EMPTY : new AggregateOutcome(false, failures);
    }

    /**
     * @return failure messages in execution order
     */
    public List<String> failureMessages() {
        return failures.stream().map(HandlerError::message).toList();
    }
}
