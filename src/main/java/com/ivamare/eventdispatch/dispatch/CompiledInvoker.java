package com.ivamare.eventdispatch.dispatch;

import com.ivamare.eventdispatch.model.CancellationToken;
import com.ivamare.eventdispatch.model.HandlerDescriptor;
import com.ivamare.eventdispatch.model.HandlerError;
import com.ivamare.eventdispatch.model.Outcome;
import com.ivamare.eventdispatch.model.ParameterSlot;
import com.ivamare.eventdispatch.resolver.DependencyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandle;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Invoker over a spread method handle of type {@code (Object[]) -> Object}.
 */
final class CompiledInvoker implements Invoker {

    private static final Logger log = LoggerFactory.getLogger(CompiledInvoker.class);

    private final HandlerDescriptor descriptor;
    private final MethodHandle handle;
    private final ReturnCoercion coercion;

    CompiledInvoker(HandlerDescriptor descriptor, MethodHandle handle, ReturnCoercion coercion) {
        this.descriptor = descriptor;
        this.handle = handle;
        this.coercion = coercion;
    }

    @Override
    public CompletionStage<Outcome> invoke(Object event, DependencyResolver resolver, CancellationToken token) {
        if (!descriptor.eventType().isInstance(event)) {
            return ReturnCoercion.SUCCESS;
        }

        try {
            Object[] args = new Object[descriptor.parameterCount()];
            args[0] = event;
            for (ParameterSlot slot : descriptor.parameters()) {
                if (slot.isDependency()) {
                    Optional<?> dependency = resolver.resolve(slot.type());
                    if (dependency.isEmpty()) {
                        return CompletableFuture.completedFuture(Outcome.failure(HandlerError.of(
                            HandlerError.DEPENDENCY_UNAVAILABLE,
                            "No " + slot.type().getName() + " available for " + descriptor.describe())));
                    }
                    args[slot.index()] = dependency.get();
                } else {
                    args[slot.index()] = token;
                }
            }

            Object returned = (Object) handle.invokeExact(args);
            return coercion.coerce(returned);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.debug("Handler {} raised a fault", descriptor.describe(), t);
            return CompletableFuture.completedFuture(Outcome.failure(HandlerError.fault(t)));
        }
    }

    @Override
    public HandlerDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public String toString() {
        return "Invoker[" + descriptor.describe() + "]";
    }
}
