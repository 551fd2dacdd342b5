package com.ivamare.eventdispatch.resolver;

import org.springframework.beans.factory.BeanFactoryUtils;
import org.springframework.beans.factory.ListableBeanFactory;

import java.util.Optional;

/**
 * Resolver backed by a Spring bean factory.
 *
 * <p>Beans are looked up on every call, so prototype and request scoped beans
 * behave according to their scope. Ancestor contexts are searched as well.
 */
public class BeanFactoryDependencyResolver implements DependencyResolver {

    private final ListableBeanFactory beanFactory;

    public BeanFactoryDependencyResolver(ListableBeanFactory beanFactory) {
        this.beanFactory = beanFactory;
    }

    @Override
    public <T> Optional<T> resolve(Class<T> type) {
        return Optional.ofNullable(beanFactory.getBeanProvider(type).getIfUnique());
    }

    @Override
    public boolean canResolve(Class<?> type) {
        String[] names = BeanFactoryUtils.beanNamesForTypeIncludingAncestors(beanFactory, type);
        if (names.length == 1) {
            return true;
        }
        // several candidates resolve only when one of them is primary
        return names.length > 1 && beanFactory.getBeanProvider(type).getIfUnique() != null;
    }
}
