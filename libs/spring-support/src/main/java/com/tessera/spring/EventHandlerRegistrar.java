package com.tessera.spring;

import com.tessera.eventbus.EventBus;
import com.tessera.eventbus.EventHandler;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;

/**
 * Subscribes every {@link EventHandler} bean to the {@link EventBus} once all singletons exist,
 * in {@link org.springframework.core.annotation.Order} order, and unsubscribes them when the
 * context closes.
 */
public class EventHandlerRegistrar implements SmartInitializingSingleton, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(EventHandlerRegistrar.class);

    private final ListableBeanFactory beanFactory;
    private final EventBus eventBus;
    private final List<EventHandler> subscribed = new ArrayList<>();

    public EventHandlerRegistrar(ListableBeanFactory beanFactory, EventBus eventBus) {
        this.beanFactory = beanFactory;
        this.eventBus = eventBus;
    }

    @Override
    public void afterSingletonsInstantiated() {
        beanFactory.getBeanProvider(EventHandler.class).orderedStream().forEach(handler -> {
            eventBus.subscribe(handler);
            subscribed.add(handler);
        });
        log.info("Subscribed {} event handler bean(s)", subscribed.size());
    }

    @Override
    public void destroy() {
        subscribed.forEach(eventBus::unsubscribe);
        log.debug("Unsubscribed {} event handler bean(s)", subscribed.size());
        subscribed.clear();
    }

    /** Handlers this registrar subscribed, in subscription order. */
    public List<EventHandler> subscribedHandlers() {
        return List.copyOf(subscribed);
    }
}
