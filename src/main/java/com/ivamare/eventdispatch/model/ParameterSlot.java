package com.ivamare.eventdispatch.model;

/**
 * A handler parameter after the event parameter.
 *
 * @param index Position in the handler's parameter list (always at least 1)
 * @param type Declared parameter type
 * @param kind How the value is supplied at call time
 */
public record ParameterSlot(
    int index,
    Class<?> type,
    Kind kind
) {
    public enum Kind {
        /** Resolved from the dependency resolver on every call. */
        DEPENDENCY,
        /** Bound to the dispatch call's cancellation token. */
        CANCELLATION
    }

    public static ParameterSlot dependency(int index, Class<?> type) {
        return new ParameterSlot(index, type, Kind.DEPENDENCY);
    }

    public static ParameterSlot cancellation(int index) {
        return new ParameterSlot(index, CancellationToken.class, Kind.CANCELLATION);
    }

    public boolean isDependency() {
        return kind == Kind.DEPENDENCY;
    }
}
