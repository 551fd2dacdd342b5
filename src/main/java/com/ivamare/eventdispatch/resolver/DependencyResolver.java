package com.ivamare.eventdispatch.resolver;

import java.util.Optional;

/**
 * Supplies values for handler dependency slots.
 *
 * <p>Implementations are shared by every dispatch call and must tolerate concurrent
 * resolution. The dispatcher never caches resolved instances; it asks again on
 * every handler invocation.
 */
public interface DependencyResolver {

    /**
     * Resolve an instance of the given type.
     *
     * @param type The dependency type
     * @param <T> dependency type
     * @return the instance, or empty if none is available
     */
    <T> Optional<T> resolve(Class<T> type);

    /**
     * Check whether the type can be resolved at all. Used when the dispatch table is
     * built, so handlers that can never run are rejected before any event is accepted.
     *
     * @param type The dependency type
     * @return true if {@link #resolve(Class)} is expected to return a value
     */
    boolean canResolve(Class<?> type);
}
