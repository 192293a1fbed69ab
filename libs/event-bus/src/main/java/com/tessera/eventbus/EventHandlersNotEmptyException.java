package com.tessera.eventbus;

import com.tessera.eventmodel.DomainEventException;

import java.util.List;

/**
 * Thrown by {@link EventBus#assertEmpty()} when subscriptions remain registered.
 */
public class EventHandlersNotEmptyException extends DomainEventException {

    private final List<String> subscriptions;

    public EventHandlersNotEmptyException(List<String> subscriptions) {
        super("Event bus still has " + subscriptions.size() + " subscription(s): " + subscriptions);
        this.subscriptions = List.copyOf(subscriptions);
    }

    /** Descriptions of the subscriptions left on the bus. */
    public List<String> subscriptions() {
        return subscriptions;
    }
}
