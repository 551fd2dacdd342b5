package com.ivamare.eventdispatch.dispatch;

import com.ivamare.eventdispatch.model.HandlerError;
import com.ivamare.eventdispatch.model.Outcome;
import com.ivamare.eventdispatch.model.Result;
import com.ivamare.eventdispatch.model.ReturnShape;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Converts a handler's raw return value to an outcome. One coercion is picked per
 * handler from its declared {@link ReturnShape}.
 */
@FunctionalInterface
interface ReturnCoercion {

    CompletionStage<Outcome> coerce(Object returned);

    CompletionStage<Outcome> SUCCESS = CompletableFuture.completedStage(Outcome.success());

    static ReturnCoercion forShape(ReturnShape shape) {
        return switch (shape) {
            case NONE, ACKNOWLEDGEMENT -> returned -> SUCCESS;
            case RESULT -> returned -> CompletableFuture.completedFuture(fromResult(returned));
            case ASYNC_NONE, ASYNC_ACKNOWLEDGEMENT -> returned -> await(returned, value -> Outcome.success());
            case ASYNC_RESULT -> returned -> await(returned, ReturnCoercion::fromResult);
        };
    }

    private static Outcome fromResult(Object returned) {
        if (returned == null) {
            return Outcome.failure(HandlerError.of(HandlerError.FAULT, "handler returned null instead of a result"));
        }
        return ((Result) returned).toOutcome();
    }

    private static CompletionStage<Outcome> await(Object returned, Function<Object, Outcome> onValue) {
        if (returned == null) {
            return CompletableFuture.completedFuture(
                Outcome.failure(HandlerError.of(HandlerError.FAULT, "handler returned null instead of a stage")));
        }
        return ((CompletionStage<?>) returned).handle((value, failure) ->
            failure != null ? Outcome.failure(HandlerError.fault(failure)) : onValue.apply(value));
    }
}
