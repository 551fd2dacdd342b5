package com.ivamare.eventdispatch.dispatch;

import com.ivamare.eventdispatch.model.CancellationToken;
import com.ivamare.eventdispatch.model.HandlerDescriptor;
import com.ivamare.eventdispatch.model.Outcome;
import com.ivamare.eventdispatch.resolver.DependencyResolver;

import java.util.concurrent.CompletionStage;

/**
 * Compiled adapter bound to exactly one handler.
 *
 * <p>Invokers produced by {@link AdapterCompiler} never throw and never complete
 * exceptionally: handler faults are returned as failed outcomes.
 */
public interface Invoker {

    /**
     * Run the handler for one event.
     *
     * @param event The dispatched event
     * @param resolver Resolver for the handler's dependency slots
     * @param token Cancellation token bound to the handler's cancellation slot
     * @return stage completing with the handler's outcome
     */
    CompletionStage<Outcome> invoke(Object event, DependencyResolver resolver, CancellationToken token);

    /**
     * @return the descriptor this invoker was compiled from
     */
    HandlerDescriptor descriptor();
}
