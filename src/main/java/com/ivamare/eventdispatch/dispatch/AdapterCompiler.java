package com.ivamare.eventdispatch.dispatch;

import com.ivamare.eventdispatch.exception.HandlerCompilationException;
import com.ivamare.eventdispatch.model.HandlerDescriptor;
import com.ivamare.eventdispatch.model.ParameterSlot;
import com.ivamare.eventdispatch.resolver.DependencyResolver;
import org.springframework.util.ReflectionUtils;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;

/**
 * Compiles handler descriptors into invokers.
 *
 * <p>Everything that depends only on the handler's signature is settled here, once:
 * dependency slots are checked against the resolver, the method is turned into a
 * method handle taking a single argument array, and the return coercion is chosen
 * from the declared return shape. Invocation then does no signature inspection.
 */
public class AdapterCompiler {

    private static final MethodType SPREAD_TYPE = MethodType.methodType(Object.class, Object[].class);

    private final DependencyResolver resolver;

    /**
     * @param resolver Resolver the compiled handlers will be invoked with
     */
    public AdapterCompiler(DependencyResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Compile one descriptor.
     *
     * @param descriptor The validated descriptor
     * @return invoker bound to the descriptor
     * @throws HandlerCompilationException if a dependency slot can never be resolved
     *         or the method cannot be accessed
     */
    public Invoker compile(HandlerDescriptor descriptor) {
        for (ParameterSlot slot : descriptor.dependencySlots()) {
            if (!resolver.canResolve(slot.type())) {
                throw new HandlerCompilationException(descriptor, slot.type());
            }
        }

        MethodHandle handle = spreadHandle(descriptor);
        ReturnCoercion coercion = ReturnCoercion.forShape(descriptor.returnShape());
        return new CompiledInvoker(descriptor, handle, coercion);
    }

    private static MethodHandle spreadHandle(HandlerDescriptor descriptor) {
        Method method = descriptor.method();
        MethodHandle handle;
        try {
            ReflectionUtils.makeAccessible(method);
            handle = MethodHandles.lookup().unreflect(method);
        } catch (IllegalAccessException | RuntimeException e) {
            throw new HandlerCompilationException(descriptor, "handler method is not accessible", e);
        }

        if (!descriptor.isStatic()) {
            handle = handle.bindTo(descriptor.target());
        }
        return handle.asFixedArity()
            .asSpreader(Object[].class, descriptor.parameterCount())
            .asType(SPREAD_TYPE);
    }
}
