package com.ivamare.eventdispatch.resolver;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Resolver backed by a fixed set of suppliers keyed by exact type.
 *
 * <p>Intended for use without a Spring context. Suppliers are called on every
 * resolution, so a supplier may hand out a fresh instance per call.
 */
public final class MapDependencyResolver implements DependencyResolver {

    private final Map<Class<?>, Supplier<?>> suppliers;

    private MapDependencyResolver(Map<Class<?>, Supplier<?>> suppliers) {
        this.suppliers = Map.copyOf(suppliers);
    }

    public static MapDependencyResolver empty() {
        return new MapDependencyResolver(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Optional<T> resolve(Class<T> type) {
        Supplier<?> supplier = suppliers.get(type);
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.ofNullable((T) supplier.get());
    }

    @Override
    public boolean canResolve(Class<?> type) {
        return suppliers.containsKey(type);
    }

    /**
     * Builder for MapDependencyResolver.
     */
    public static final class Builder {

        private final Map<Class<?>, Supplier<?>> suppliers = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Register a singleton instance.
         *
         * @param type The type handlers declare
         * @param instance The instance handed out
         * @return this builder
         */
        public <T> Builder instance(Class<T> type, T instance) {
            if (instance == null) {
                throw new IllegalArgumentException("instance must not be null");
            }
            suppliers.put(type, () -> instance);
            return this;
        }

        /**
         * Register a supplier called on every resolution.
         *
         * @param type The type handlers declare
         * @param supplier Supplier of instances
         * @return this builder
         */
        public <T> Builder supplier(Class<T> type, Supplier<? extends T> supplier) {
            if (supplier == null) {
                throw new IllegalArgumentException("supplier must not be null");
            }
            suppliers.put(type, supplier);
            return this;
        }

        public MapDependencyResolver build() {
            return new MapDependencyResolver(suppliers);
        }
    }
}
