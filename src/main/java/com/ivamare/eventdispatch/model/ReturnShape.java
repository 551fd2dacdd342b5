package com.ivamare.eventdispatch.model;

import org.springframework.core.ResolvableType;

import java.lang.reflect.Method;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Declared return shape of a handler, resolved once at registration.
 *
 * <p>Each shape selects its own coercion to {@link Outcome} when the handler is compiled.
 */
public enum ReturnShape {
    /** {@code void} or {@code Void}. */
    NONE(false),
    /** {@link Acknowledgement}. */
    ACKNOWLEDGEMENT(false),
    /** Any {@link Result} implementation. */
    RESULT(false),
    /** {@code CompletionStage<Void>}. */
    ASYNC_NONE(true),
    /** {@code CompletionStage<Acknowledgement>}. */
    ASYNC_ACKNOWLEDGEMENT(true),
    /** {@code CompletionStage<? extends Result>}. */
    ASYNC_RESULT(true);

    private final boolean async;

    ReturnShape(boolean async) {
        this.async = async;
    }

    public boolean isAsync() {
        return async;
    }

    /**
     * Determine the return shape of a handler method.
     *
     * @param method The handler method
     * @return the shape, or empty if the declared return type cannot be coerced to an outcome
     */
    public static Optional<ReturnShape> of(Method method) {
        ResolvableType returnType = ResolvableType.forMethodReturnType(method);
        Class<?> declared = returnType.resolve();
        if (declared == null) {
            return Optional.empty();
        }
        if (CompletionStage.class.isAssignableFrom(declared)) {
            Class<?> completesWith = returnType.as(CompletionStage.class).getGeneric(0).resolve();
            return Optional.ofNullable(classifyAsync(completesWith));
        }
        return Optional.ofNullable(classify(declared));
    }

    private static ReturnShape classify(Class<?> type) {
        if (type == void.class || type == Void.class) {
            return NONE;
        }
        if (type == Acknowledgement.class) {
            return ACKNOWLEDGEMENT;
        }
        if (Result.class.isAssignableFrom(type)) {
            return RESULT;
        }
        return null;
    }

    private static ReturnShape classifyAsync(Class<?> type) {
        if (type == null) {
            return null;
        }
        ReturnShape inner = classify(type);
        if (inner == null) {
            return null;
        }
        return switch (inner) {
            case NONE -> ASYNC_NONE;
            case ACKNOWLEDGEMENT -> ASYNC_ACKNOWLEDGEMENT;
            default -> ASYNC_RESULT;
        };
    }
}
