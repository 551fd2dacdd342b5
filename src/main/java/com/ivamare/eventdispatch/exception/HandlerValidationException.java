package com.ivamare.eventdispatch.exception;

import java.lang.reflect.Method;

/**
 * Raised synchronously at registration when a handler's shape is unsupported,
 * or when the registry no longer accepts registrations.
 *
 * <p>Fatal to the registration call only; nothing is added to the registry.
 */
public class HandlerValidationException extends EventDispatchException {

    public static final String REGISTRY_SEALED = "registry sealed";
    public static final String UNSUPPORTED_RETURN_SHAPE = "unsupported return shape";
    public static final String NON_CONCRETE_EVENT_TYPE = "event type must be a concrete class";

    private final Class<?> eventType;
    private final Method method;
    private final String reason;

    public HandlerValidationException(Class<?> eventType, Method method, String reason) {
        super(describe(eventType, method, reason));
        this.eventType = eventType;
        this.method = method;
        this.reason = reason;
    }

    public Class<?> getEventType() {
        return eventType;
    }

    /**
     * @return the rejected handler method, or null when the method could not be determined
     */
    public Method getMethod() {
        return method;
    }

    public String getReason() {
        return reason;
    }

    private static String describe(Class<?> eventType, Method method, String reason) {
        StringBuilder sb = new StringBuilder("Cannot register handler");
        if (method != null) {
            sb.append(' ').append(method.getDeclaringClass().getSimpleName())
                .append('.').append(method.getName()).append("()");
        }
        if (eventType != null) {
            sb.append(" for ").append(eventType.getSimpleName());
        }
        return sb.append(": ").append(reason).toString();
    }
}
