package com.ivamare.eventdispatch.handler;

import com.ivamare.eventdispatch.model.HandlerDescriptor;
import com.ivamare.eventdispatch.model.Result;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Registry of event handlers.
 *
 * <p>Accumulates validated handler descriptors per event type during setup.
 * Once sealed, the registry is read-only and every registration is rejected.
 */
public interface HandlerRegistry {

    /**
     * Register a handler method for an event type.
     *
     * @param eventType The event type the handler subscribes to
     * @param target Instance to invoke the method on (ignored for static methods)
     * @param method The handler method
     * @return the validated descriptor
     * @throws com.ivamare.eventdispatch.exception.HandlerValidationException if the
     *         method's shape is unsupported or the registry is sealed
     */
    HandlerDescriptor register(Class<?> eventType, Object target, Method method);

    /**
     * Register the single public method named {@code methodName} on the target's class.
     *
     * @param eventType The event type the handler subscribes to
     * @param target Instance declaring the method
     * @param methodName Method name
     * @return the validated descriptor
     * @throws com.ivamare.eventdispatch.exception.HandlerValidationException if no method
     *         or more than one method has that name, or the shape is unsupported
     */
    HandlerDescriptor register(Class<?> eventType, Object target, String methodName);

    /**
     * Register a function as a handler.
     *
     * <p>Lambdas implementing generic functional interfaces erase their parameter to
     * {@code Object} and so cannot be registered by method name; use this overload instead.
     * The function takes no dependencies or cancellation token, and a {@code null} return
     * is reported as a handler fault.
     *
     * @param eventType The event type the handler subscribes to
     * @param handler Function producing the handler's result
     * @param <E> event type
     * @return the registered descriptor
     * @throws com.ivamare.eventdispatch.exception.HandlerValidationException if the event
     *         type is not a concrete class or the registry is sealed
     */
    <E> HandlerDescriptor register(Class<E> eventType, Function<? super E, ? extends Result> handler);

    /**
     * Register the single public static method named {@code methodName} on {@code owner}.
     *
     * @param eventType The event type the handler subscribes to
     * @param owner Class declaring the method
     * @param methodName Method name
     * @return the validated descriptor
     */
    HandlerDescriptor registerStatic(Class<?> eventType, Class<?> owner, String methodName);

    /**
     * Scan a bean for @EventHandler annotated methods and register them.
     *
     * @param bean The bean to scan
     * @return descriptors registered, in discovery order
     */
    List<HandlerDescriptor> registerBean(Object bean);

    /**
     * Stop accepting registrations. Idempotent.
     */
    void seal();

    boolean isSealed();

    /**
     * @param eventType The event type
     * @return descriptors for the event type in registration order (empty if none)
     */
    List<HandlerDescriptor> descriptorsFor(Class<?> eventType);

    /**
     * @return all descriptors in registration order
     */
    List<HandlerDescriptor> descriptors();

    /**
     * @return event types with at least one handler
     */
    Set<Class<?>> eventTypes();

    boolean hasHandlers(Class<?> eventType);
}
