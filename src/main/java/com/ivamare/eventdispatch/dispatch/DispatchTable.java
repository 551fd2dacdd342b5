package com.ivamare.eventdispatch.dispatch;

import com.ivamare.eventdispatch.exception.DispatchTableBuildException;
import com.ivamare.eventdispatch.exception.HandlerCompilationException;
import com.ivamare.eventdispatch.handler.HandlerRegistry;
import com.ivamare.eventdispatch.model.HandlerDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable mapping from event type to the invokers registered for it.
 *
 * <p>Invokers keep registration order. Event types without handlers have no entry.
 * Built once at startup; safe for unsynchronized concurrent reads.
 */
public final class DispatchTable {

    private static final Logger log = LoggerFactory.getLogger(DispatchTable.class);

    private final Map<Class<?>, List<Invoker>> invokers;
    private final int size;

    private DispatchTable(Map<Class<?>, List<Invoker>> invokers) {
        this.invokers = Map.copyOf(invokers);
        this.size = invokers.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Seal the registry and compile every registered handler.
     *
     * @param registry The handler registry (sealed by this call)
     * @param compiler Compiler producing the invokers
     * @return the dispatch table
     * @throws DispatchTableBuildException if any handler fails to compile; no table is produced
     */
    public static DispatchTable build(HandlerRegistry registry, AdapterCompiler compiler) {
        registry.seal();

        Map<Class<?>, List<Invoker>> grouped = new LinkedHashMap<>();
        for (HandlerDescriptor descriptor : registry.descriptors()) {
            Invoker invoker;
            try {
                invoker = compiler.compile(descriptor);
            } catch (HandlerCompilationException e) {
                throw new DispatchTableBuildException(e);
            }
            grouped.computeIfAbsent(descriptor.eventType(), k -> new ArrayList<>()).add(invoker);
        }

        grouped.replaceAll((eventType, list) -> List.copyOf(list));
        DispatchTable table = new DispatchTable(grouped);
        log.info("Built dispatch table with {} handlers for {} event types", table.size(), grouped.size());
        return table;
    }

    /**
     * @param eventType The exact event type
     * @return invokers in registration order, empty if none
     */
    public List<Invoker> invokersFor(Class<?> eventType) {
        return invokers.getOrDefault(eventType, List.of());
    }

    public Set<Class<?>> eventTypes() {
        return invokers.keySet();
    }

    /**
     * @return total number of invokers
     */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }
}
