package com.ivamare.eventdispatch.dispatch.impl;

import com.ivamare.eventdispatch.dispatch.AdapterCompiler;
import com.ivamare.eventdispatch.dispatch.DispatchTable;
import com.ivamare.eventdispatch.dispatch.EventDispatcher;
import com.ivamare.eventdispatch.dispatch.Invoker;
import com.ivamare.eventdispatch.exception.InvalidOperationException;
import com.ivamare.eventdispatch.handler.EventHandlerRegistrar;
import com.ivamare.eventdispatch.handler.HandlerRegistry;
import com.ivamare.eventdispatch.model.AggregateOutcome;
import com.ivamare.eventdispatch.model.CancellationToken;
import com.ivamare.eventdispatch.model.HandlerError;
import com.ivamare.eventdispatch.model.Outcome;
import com.ivamare.eventdispatch.resolver.DependencyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Default implementation of EventDispatcher.
 *
 * <p>Implements SmartInitializingSingleton so that, inside a Spring context, the
 * dispatch table is built once every singleton (and so every annotated handler)
 * exists. A build failure aborts context startup.
 *
 * <p>Invokers for one event run strictly sequentially: the next one starts only after
 * the previous one's stage has completed. Concurrent dispatch calls share nothing but
 * the immutable table and the resolver.
 */
public class DefaultEventDispatcher implements EventDispatcher, SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventDispatcher.class);

    private final HandlerRegistry registry;
    private final AdapterCompiler compiler;
    private final DependencyResolver resolver;
    private final List<EventHandlerRegistrar> registrars;
    private final boolean logFailures;
    private volatile DispatchTable table;

    /**
     * Create a dispatcher. The dispatch table is built by {@link #initialize()}.
     *
     * @param registry Registry holding the handlers
     * @param compiler Compiler for the registered handlers
     * @param resolver Resolver handed to every invoker
     * @param registrars Programmatic registrations applied before the table is built
     * @param logFailures Whether failed dispatches are logged at WARN
     */
    public DefaultEventDispatcher(
            HandlerRegistry registry,
            AdapterCompiler compiler,
            DependencyResolver resolver,
            List<EventHandlerRegistrar> registrars,
            boolean logFailures) {
        this.registry = registry;
        this.compiler = compiler;
        this.resolver = resolver;
        this.registrars = List.copyOf(registrars);
        this.logFailures = logFailures;
    }

    @Override
    public void afterSingletonsInstantiated() {
        initialize();
    }

    /**
     * Apply registrars, seal the registry and build the dispatch table. Idempotent.
     *
     * @throws com.ivamare.eventdispatch.exception.DispatchTableBuildException if any
     *         handler cannot be compiled
     */
    public synchronized void initialize() {
        if (table != null) {
            return;
        }
        for (EventHandlerRegistrar registrar : registrars) {
            registrar.registerHandlers(registry);
        }
        table = DispatchTable.build(registry, compiler);
    }

    public boolean isInitialized() {
        return table != null;
    }

    /**
     * @return the dispatch table
     * @throws InvalidOperationException if the table has not been built
     */
    public DispatchTable dispatchTable() {
        DispatchTable current = table;
        if (current == null) {
            throw new InvalidOperationException("Dispatch table has not been built");
        }
        return current;
    }

    @Override
    public CompletableFuture<AggregateOutcome> dispatchAsync(Object event, CancellationToken token) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        CancellationToken effectiveToken = token != null ? token : CancellationToken.NONE;
        String eventName = event.getClass().getSimpleName();

        List<Invoker> invokers = dispatchTable().invokersFor(event.getClass());
        if (invokers.isEmpty()) {
            log.debug("No handlers registered for {}", eventName);
            return CompletableFuture.completedFuture(AggregateOutcome.empty());
        }

        log.debug("Dispatching {} to {} handlers", eventName, invokers.size());

        List<HandlerError> failures = new ArrayList<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Invoker invoker : invokers) {
            chain = chain
                .thenCompose(ignored -> invokeSafely(invoker, event, effectiveToken))
                .thenAccept(outcome -> outcome.error().ifPresent(failures::add));
        }

        return chain.thenApply(ignored -> {
            AggregateOutcome outcome = AggregateOutcome.of(failures);
            if (!outcome.success() && logFailures) {
                log.warn("Dispatch of {} completed with {} failed handler(s): {}",
                    eventName, outcome.failures().size(), outcome.failureMessages());
            }
            return outcome;
        });
    }

    private CompletionStage<Outcome> invokeSafely(Invoker invoker, Object event, CancellationToken token) {
        try {
            CompletionStage<Outcome> stage = invoker.invoke(event, resolver, token);
            if (stage == null) {
                return CompletableFuture.completedFuture(nullOutcome(invoker));
            }
            return stage.handle((outcome, failure) -> {
                if (failure != null) {
                    return Outcome.failure(HandlerError.fault(failure));
                }
                return outcome != null ? outcome : nullOutcome(invoker);
            });
        } catch (RuntimeException e) {
            log.debug("Invoker {} threw instead of returning an outcome", invoker, e);
            return CompletableFuture.completedFuture(Outcome.failure(HandlerError.fault(e)));
        }
    }

    private static Outcome nullOutcome(Invoker invoker) {
        return Outcome.failure(HandlerError.of(HandlerError.FAULT, invoker + " produced no outcome"));
    }
}
