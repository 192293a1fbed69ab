package com.tessera.eventbus;

import com.tessera.eventmodel.DomainEvent;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A self-filtering {@link EventHandler}. Equal only for the same handler object.
 */
final class HandlerSubscription implements Subscription {

    private final EventHandler handler;

    HandlerSubscription(EventHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        this.handler = handler;
    }

    @Override
    public boolean fires(List<DomainEvent> events, Map<BatchPredicate, Boolean> predicateResults,
                         EventBusMetrics metrics) {
        EventFilter filter = handler.eventFilter();
        if (filter == null) {
            throw new IllegalStateException("Handler " + handler + " declared no event filter");
        }
        return filter.matches(events);
    }

    @Override
    public CompletableFuture<Void> deliver(List<DomainEvent> events) {
        return handler.handle(events);
    }

    @Override
    public String flavor() {
        return "handler";
    }

    EventHandler handler() {
        return handler;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof HandlerSubscription subscription && subscription.handler == handler;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(handler);
    }

    @Override
    public String toString() {
        return "HandlerSubscription[" + handler + "]";
    }
}
