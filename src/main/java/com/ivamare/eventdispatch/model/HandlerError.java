package com.ivamare.eventdispatch.model;

import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Failure payload produced by a handler, either returned deliberately or
 * converted from a fault raised while the handler ran.
 *
 * @param code Application error code
 * @param message Human readable description
 * @param details Additional context (never null)
 * @param cause Fault that produced this error (nullable, set only for faults)
 */
public record HandlerError(
    String code,
    String message,
    Map<String, Object> details,
    Throwable cause
) {
    /** Code used when a handler returns a failure without naming one. */
    public static final String FAILURE = "HANDLER_FAILURE";

    /** Code used for faults raised by the handler itself. */
    public static final String FAULT = "HANDLER_FAULT";

    /** Code used when a dependency cannot be resolved at call time. */
    public static final String DEPENDENCY_UNAVAILABLE = "DEPENDENCY_UNAVAILABLE";

    public HandlerError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static HandlerError of(String message) {
        return new HandlerError(FAILURE, message, Map.of(), null);
    }

    public static HandlerError of(String code, String message) {
        return new HandlerError(code, message, Map.of(), null);
    }

    public static HandlerError of(String code, String message, Map<String, Object> details) {
        return new HandlerError(code, message, details, null);
    }

    /**
     * Convert a fault raised by a handler into a failure payload carrying its description.
     *
     * <p>Reflection and future wrappers are unwrapped so the payload describes the
     * handler's own exception.
     */
    public static HandlerError fault(Throwable fault) {
        Throwable cause = unwrap(fault);
        return new HandlerError(FAULT, cause.toString(), Map.of(), cause);
    }

    private static Throwable unwrap(Throwable fault) {
        Throwable current = fault;
        while ((current instanceof CompletionException
                || current instanceof ExecutionException
                || current instanceof InvocationTargetException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public boolean isFault() {
        return cause != null;
    }

    @Override
    public String toString() {
        return "[" + code + "] " + message;
    }
}
