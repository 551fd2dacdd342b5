package com.ivamare.eventdispatch.handler;

/**
 * Callback for registering handlers programmatically.
 *
 * <p>Beans of this type are applied before the dispatch table is built, after
 * annotated handlers have been discovered. Registration fails once the table exists.
 */
@FunctionalInterface
public interface EventHandlerRegistrar {

    void registerHandlers(HandlerRegistry registry);
}
