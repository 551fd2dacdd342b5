package com.ivamare.eventdispatch.exception;

import com.ivamare.eventdispatch.model.HandlerDescriptor;

/**
 * Thrown when a validated handler descriptor cannot be compiled into an invoker,
 * typically because one of its dependency slots can never be resolved.
 */
public class HandlerCompilationException extends EventDispatchException {

    private final transient HandlerDescriptor descriptor;
    private final Class<?> unresolvedType;

    public HandlerCompilationException(HandlerDescriptor descriptor, Class<?> unresolvedType) {
        super("No dependency of type " + unresolvedType.getName()
            + " available for handler " + descriptor.describe());
        this.descriptor = descriptor;
        this.unresolvedType = unresolvedType;
    }

    public HandlerCompilationException(HandlerDescriptor descriptor, String message, Throwable cause) {
        super("Cannot compile handler " + descriptor.describe() + ": " + message, cause);
        this.descriptor = descriptor;
        this.unresolvedType = null;
    }

    public HandlerDescriptor getDescriptor() {
        return descriptor;
    }

    /**
     * @return the dependency type the resolver could not supply, or null for other failures
     */
    public Class<?> getUnresolvedType() {
        return unresolvedType;
    }
}
