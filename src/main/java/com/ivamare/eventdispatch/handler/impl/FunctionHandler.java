package com.ivamare.eventdispatch.handler.impl;

import com.ivamare.eventdispatch.model.Result;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Method;
import java.util.function.Function;

/**
 * Exposes a typed function as a handler method so it can be compiled like any other.
 *
 * <p>{@link #handle(Object)} is only reached with instances of the event type; the
 * invoker checks the event before calling it.
 */
final class FunctionHandler<E> {

    static final Method HANDLE = ReflectionUtils.findMethod(FunctionHandler.class, "handle", Object.class);

    private final Class<E> eventType;
    private final Function<? super E, ? extends Result> function;

    FunctionHandler(Class<E> eventType, Function<? super E, ? extends Result> function) {
        this.eventType = eventType;
        this.function = function;
    }

    public Result handle(Object event) {
        return function.apply(eventType.cast(event));
    }

    @Override
    public String toString() {
        return "FunctionHandler[" + eventType.getSimpleName() + "]";
    }
}
