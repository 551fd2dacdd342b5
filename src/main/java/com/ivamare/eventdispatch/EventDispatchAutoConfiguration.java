package com.ivamare.eventdispatch;

import com.ivamare.eventdispatch.dispatch.AdapterCompiler;
import com.ivamare.eventdispatch.dispatch.EventDispatcher;
import com.ivamare.eventdispatch.dispatch.impl.DefaultEventDispatcher;
import com.ivamare.eventdispatch.handler.EventHandlerRegistrar;
import com.ivamare.eventdispatch.handler.HandlerRegistry;
import com.ivamare.eventdispatch.handler.impl.DefaultHandlerRegistry;
import com.ivamare.eventdispatch.resolver.BeanFactoryDependencyResolver;
import com.ivamare.eventdispatch.resolver.DependencyResolver;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

/**
 * Auto-configuration for Event Dispatch.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Handler Registry (also discovers @EventHandler methods)</li>
 *   <li>Dependency Resolver backed by the application context</li>
 *   <li>Adapter Compiler</li>
 *   <li>Event Dispatcher</li>
 * </ul>
 *
 * <p>The dispatch table is built once all singletons exist; an unresolvable
 * handler dependency fails startup.
 *
 * <p>To disable auto-configuration:
 * <pre>
 * eventdispatch.enabled=false
 * </pre>
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "eventdispatch", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(EventDispatchProperties.class)
public class EventDispatchAutoConfiguration {

    // --- Handler Registry ---

    // static: a BeanPostProcessor must not force early creation of this configuration
    @Bean
    @ConditionalOnMissingBean(HandlerRegistry.class)
    public static DefaultHandlerRegistry handlerRegistry(Environment environment) {
        boolean scanAnnotations = environment.getProperty(
            "eventdispatch.scan-annotations", Boolean.class, true);
        return new DefaultHandlerRegistry(scanAnnotations);
    }

    // --- Dependency Resolver ---

    @Bean
    @ConditionalOnMissingBean
    public DependencyResolver dependencyResolver(ListableBeanFactory beanFactory) {
        return new BeanFactoryDependencyResolver(beanFactory);
    }

    // --- Adapter Compiler ---

    @Bean
    @ConditionalOnMissingBean
    public AdapterCompiler adapterCompiler(DependencyResolver dependencyResolver) {
        return new AdapterCompiler(dependencyResolver);
    }

    // --- Event Dispatcher ---

    @Bean
    @ConditionalOnMissingBean
    public EventDispatcher eventDispatcher(
            HandlerRegistry handlerRegistry,
            AdapterCompiler adapterCompiler,
            DependencyResolver dependencyResolver,
            ObjectProvider<EventHandlerRegistrar> registrars,
            EventDispatchProperties properties) {
        return new DefaultEventDispatcher(
            handlerRegistry,
            adapterCompiler,
            dependencyResolver,
            registrars.orderedStream().toList(),
            properties.isLogFailures()
        );
    }
}
