package com.ivamare.eventdispatch.handler.impl;

import com.ivamare.eventdispatch.exception.HandlerValidationException;
import com.ivamare.eventdispatch.handler.EventHandler;
import com.ivamare.eventdispatch.handler.HandlerRegistry;
import com.ivamare.eventdispatch.model.CancellationToken;
import com.ivamare.eventdispatch.model.HandlerDescriptor;
import com.ivamare.eventdispatch.model.ParameterSlot;
import com.ivamare.eventdispatch.model.Result;
import com.ivamare.eventdispatch.model.ReturnShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Default implementation of HandlerRegistry.
 *
 * <p>Implements BeanPostProcessor to automatically discover and register
 * handlers from Spring beans with @EventHandler methods.
 */
public class DefaultHandlerRegistry implements HandlerRegistry, BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultHandlerRegistry.class);

    private final List<HandlerDescriptor> descriptors = new ArrayList<>();
    private final Map<Class<?>, List<HandlerDescriptor>> byEventType = new LinkedHashMap<>();
    private final boolean scanAnnotations;
    private volatile boolean sealed;

    public DefaultHandlerRegistry() {
        this(true);
    }

    /**
     * @param scanAnnotations whether Spring beans are scanned for @EventHandler methods
     */
    public DefaultHandlerRegistry(boolean scanAnnotations) {
        this.scanAnnotations = scanAnnotations;
    }

    @Override
    public synchronized HandlerDescriptor register(Class<?> eventType, Object target, Method method) {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType must not be null");
        }
        if (method == null) {
            throw new IllegalArgumentException("method must not be null");
        }
        if (sealed) {
            throw new HandlerValidationException(eventType, method, HandlerValidationException.REGISTRY_SEALED);
        }

        return append(validate(eventType, target, method));
    }

    @Override
    public synchronized <E> HandlerDescriptor register(Class<E> eventType, Function<? super E, ? extends Result> handler) {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType must not be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        if (sealed) {
            throw new HandlerValidationException(eventType, null, HandlerValidationException.REGISTRY_SEALED);
        }
        requireConcrete(eventType, null);

        return append(new HandlerDescriptor(eventType, new FunctionHandler<>(eventType, handler),
            FunctionHandler.HANDLE, List.of(), ReturnShape.RESULT));
    }

    @Override
    public HandlerDescriptor register(Class<?> eventType, Object target, String methodName) {
        if (target == null) {
            throw new IllegalArgumentException("target must not be null");
        }
        Method method = findMethod(eventType, ClassUtils.getUserClass(target), methodName, false);
        return register(eventType, target, method);
    }

    @Override
    public HandlerDescriptor registerStatic(Class<?> eventType, Class<?> owner, String methodName) {
        Method method = findMethod(eventType, owner, methodName, true);
        return register(eventType, null, method);
    }

    @Override
    public List<HandlerDescriptor> registerBean(Object bean) {
        List<HandlerDescriptor> registered = new ArrayList<>();

        for (Method method : annotatedMethods(ClassUtils.getUserClass(bean))) {
            EventHandler annotation = method.getAnnotation(EventHandler.class);
            HandlerDescriptor descriptor = register(annotation.value(), bean, method);
            registered.add(descriptor);

            log.info("Discovered handler {}.{}() for {}",
                bean.getClass().getSimpleName(), method.getName(), annotation.value().getSimpleName());
        }

        return registered;
    }

    /**
     * BeanPostProcessor callback - scans beans for @EventHandler methods.
     */
    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        if (scanAnnotations && !annotatedMethods(ClassUtils.getUserClass(bean)).isEmpty()) {
            registerBean(bean);
        }
        return bean;
    }

    @Override
    public void seal() {
        synchronized (this) {
            if (sealed) {
                return;
            }
            sealed = true;
        }
        log.debug("Handler registry sealed with {} handlers for {} event types",
            descriptors.size(), byEventType.size());
    }

    @Override
    public boolean isSealed() {
        return sealed;
    }

    @Override
    public synchronized List<HandlerDescriptor> descriptorsFor(Class<?> eventType) {
        List<HandlerDescriptor> list = byEventType.get(eventType);
        return list != null ? List.copyOf(list) : List.of();
    }

    @Override
    public synchronized List<HandlerDescriptor> descriptors() {
        return List.copyOf(descriptors);
    }

    @Override
    public synchronized Set<Class<?>> eventTypes() {
        return Set.copyOf(byEventType.keySet());
    }

    @Override
    public synchronized boolean hasHandlers(Class<?> eventType) {
        return byEventType.containsKey(eventType);
    }

    private HandlerDescriptor append(HandlerDescriptor descriptor) {
        descriptors.add(descriptor);
        byEventType.computeIfAbsent(descriptor.eventType(), k -> new ArrayList<>()).add(descriptor);

        log.debug("Registered handler {} (shape={}, dependencies={}, cancellable={})",
            descriptor.describe(), descriptor.returnShape(),
            descriptor.dependencySlots().size(), descriptor.hasCancellationSlot());
        return descriptor;
    }

    // dispatch looks up event.getClass(), which is never an interface or abstract class
    private static void requireConcrete(Class<?> eventType, Method method) {
        if (eventType.isInterface() || Modifier.isAbstract(eventType.getModifiers())) {
            throw new HandlerValidationException(eventType, method,
                HandlerValidationException.NON_CONCRETE_EVENT_TYPE);
        }
    }

    private HandlerDescriptor validate(Class<?> eventType, Object target, Method method) {
        requireConcrete(eventType, method);
        Class<?>[] params = method.getParameterTypes();
        if (params.length < 1) {
            throw new HandlerValidationException(eventType, method,
                "handler must accept the event as its first parameter");
        }
        if (!params[0].equals(eventType)) {
            throw new HandlerValidationException(eventType, method,
                "first parameter must be " + eventType.getName() + " but was " + params[0].getName());
        }

        ReturnShape returnShape = ReturnShape.of(method)
            .orElseThrow(() -> new HandlerValidationException(eventType, method,
                HandlerValidationException.UNSUPPORTED_RETURN_SHAPE));

        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (!isStatic && target == null) {
            throw new HandlerValidationException(eventType, method,
                "instance method requires a target");
        }
        if (!isStatic && !method.getDeclaringClass().isInstance(target)) {
            throw new HandlerValidationException(eventType, method,
                "target is not an instance of " + method.getDeclaringClass().getName());
        }

        List<ParameterSlot> slots = new ArrayList<>(params.length - 1);
        int last = params.length - 1;
        for (int i = 1; i < params.length; i++) {
            if (params[i] == CancellationToken.class) {
                if (i != last) {
                    throw new HandlerValidationException(eventType, method,
                        "cancellation token must be the last parameter");
                }
                slots.add(ParameterSlot.cancellation(i));
            } else {
                slots.add(ParameterSlot.dependency(i, params[i]));
            }
        }

        return new HandlerDescriptor(eventType, isStatic ? null : target, method, slots, returnShape);
    }

    private Method findMethod(Class<?> eventType, Class<?> owner, String methodName, boolean requireStatic) {
        List<Method> candidates = Arrays.stream(owner.getMethods())
            .filter(m -> m.getName().equals(methodName))
            .filter(m -> !m.isBridge() && !m.isSynthetic())
            .filter(m -> !requireStatic || Modifier.isStatic(m.getModifiers()))
            .toList();

        if (candidates.isEmpty()) {
            throw new HandlerValidationException(eventType, null,
                "no public " + (requireStatic ? "static " : "") + "method '" + methodName
                    + "' on " + owner.getName());
        }
        if (candidates.size() > 1) {
            throw new HandlerValidationException(eventType, null,
                "method '" + methodName + "' on " + owner.getName() + " is overloaded");
        }
        return candidates.get(0);
    }

    private static List<Method> annotatedMethods(Class<?> type) {
        // getMethods() order is unspecified; sort so registration order is stable
        return Arrays.stream(type.getMethods())
            .filter(m -> m.isAnnotationPresent(EventHandler.class))
            .sorted(Comparator.comparing(Method::getName)
                .thenComparing(m -> Arrays.toString(m.getParameterTypes())))
            .toList();
    }
}
