package com.ivamare.eventdispatch.dispatch;

import com.ivamare.eventdispatch.dispatch.impl.DefaultEventDispatcher;
import com.ivamare.eventdispatch.handler.EventHandlerRegistrar;
import com.ivamare.eventdispatch.handler.HandlerRegistry;
import com.ivamare.eventdispatch.handler.impl.DefaultHandlerRegistry;
import com.ivamare.eventdispatch.resolver.DependencyResolver;
import com.ivamare.eventdispatch.resolver.MapDependencyResolver;

import java.util.ArrayList;
import java.util.List;

/**
 * Builder for creating EventDispatcher instances outside a Spring context.
 *
 * <p>{@link #build()} builds the dispatch table eagerly, so configuration mistakes
 * surface before the dispatcher is handed out.
 */
public class EventDispatcherBuilder {

    private HandlerRegistry registry;
    private DependencyResolver resolver = MapDependencyResolver.empty();
    private final List<EventHandlerRegistrar> registrars = new ArrayList<>();
    private boolean logFailures = true;

    /**
     * Set the handler registry. Defaults to a new, empty registry.
     *
     * @param registry The registry
     * @return this builder
     */
    public EventDispatcherBuilder registry(HandlerRegistry registry) {
        this.registry = registry;
        return this;
    }

    /**
     * Set the dependency resolver. Defaults to a resolver that resolves nothing.
     *
     * @param resolver The resolver
     * @return this builder
     */
    public EventDispatcherBuilder resolver(DependencyResolver resolver) {
        this.resolver = resolver;
        return this;
    }

    /**
     * Add a programmatic registration, applied in the order added.
     *
     * @param registrar The registrar
     * @return this builder
     */
    public EventDispatcherBuilder registrar(EventHandlerRegistrar registrar) {
        this.registrars.add(registrar);
        return this;
    }

    /**
     * Scan a bean for @EventHandler methods.
     *
     * @param bean The bean
     * @return this builder
     */
    public EventDispatcherBuilder handlers(Object bean) {
        return registrar(r -> r.registerBean(bean));
    }

    /**
     * Log failed dispatches at WARN. Defaults to true.
     *
     * @param logFailures whether to log failures
     * @return this builder
     */
    public EventDispatcherBuilder logFailures(boolean logFailures) {
        this.logFailures = logFailures;
        return this;
    }

    /**
     * Build the dispatcher and its dispatch table.
     *
     * @return the dispatcher
     * @throws IllegalStateException if resolver is missing
     * @throws com.ivamare.eventdispatch.exception.DispatchTableBuildException if a
     *         handler cannot be compiled
     */
    public DefaultEventDispatcher build() {
        if (resolver == null) {
            throw new IllegalStateException("resolver is required");
        }
        HandlerRegistry effectiveRegistry = registry != null ? registry : new DefaultHandlerRegistry(false);

        DefaultEventDispatcher dispatcher = new DefaultEventDispatcher(
            effectiveRegistry,
            new AdapterCompiler(resolver),
            resolver,
            registrars,
            logFailures
        );
        dispatcher.initialize();
        return dispatcher;
    }
}
