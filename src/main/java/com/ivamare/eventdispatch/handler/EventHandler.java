package com.ivamare.eventdispatch.handler;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as an event handler.
 *
 * <p>Methods annotated with @EventHandler are discovered and registered by the
 * HandlerRegistry when the bean is created.
 *
 * <p>The first parameter must be exactly the event type. Further parameters are
 * resolved from the application context on every call, except a trailing
 * {@link com.ivamare.eventdispatch.model.CancellationToken}, which receives the
 * token passed to the dispatcher.
 *
 * <p>Supported return types: {@code void}, {@code Acknowledgement}, any
 * {@code Result} (e.g. {@code Outcome}, {@code ValueOutcome<T>}), or a
 * {@code CompletionStage} of one of those.
 *
 * <p>Example:
 * <pre>
 * {@literal @}Component
 * public class MessageHandlers {
 *
 *     {@literal @}EventHandler(MessageCreated.class)
 *     public Outcome onMessage(MessageCreated event, ModerationService moderation, CancellationToken ct) {
 *         return moderation.isAllowed(event.content())
 *             ? Outcome.success()
 *             : Outcome.failure("message rejected");
 *     }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventHandler {

    /**
     * The event type this handler subscribes to.
     *
     * @return event type
     */
    Class<?> value();
}
