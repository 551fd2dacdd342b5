package com.ivamare.eventdispatch.model;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;

/**
 * Validated metadata for one registered handler.
 *
 * <p>Created by the handler registry once validation succeeds and never changed afterwards.
 *
 * @param eventType Event type the handler was registered for
 * @param target Instance the method is invoked on (null for static methods)
 * @param method The handler method
 * @param parameters Slots for every parameter after the event, in declaration order
 * @param returnShape Declared return shape
 */
public record HandlerDescriptor(
    Class<?> eventType,
    Object target,
    Method method,
    List<ParameterSlot> parameters,
    ReturnShape returnShape
) {
    public HandlerDescriptor {
        parameters = List.copyOf(parameters);
    }

    public int parameterCount() {
        return parameters.size() + 1;
    }

    public List<ParameterSlot> dependencySlots() {
        return parameters.stream().filter(ParameterSlot::isDependency).toList();
    }

    public boolean hasCancellationSlot() {
        return !parameters.isEmpty()
            && parameters.get(parameters.size() - 1).kind() == ParameterSlot.Kind.CANCELLATION;
    }

    public boolean isStatic() {
        return Modifier.isStatic(method.getModifiers());
    }

    /**
     * @return {@code Owner.method(Event)} for logs and error messages
     */
    public String describe() {
        return method.getDeclaringClass().getSimpleName() + "." + method.getName()
            + "(" + eventType.getSimpleName() + ")";
    }
}
