package com.tessera.eventbus;

import com.tessera.eventmodel.DomainEvent;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Self-filtering subscriber: the handler object declares which events it is interested in.
 * <p>
 * The bus evaluates {@link #eventFilter()} once per handler per publish call and, if it matches,
 * hands over the complete batch. Handlers that only care about the matching events narrow the
 * batch themselves with {@link #filter(List)}.
 * <p>
 * Subscriptions are deduplicated by object identity.
 */
public interface EventHandler {

    /** The rule deciding which batches this handler receives. */
    EventFilter eventFilter();

    /**
     * Handles a batch accepted by {@link #eventFilter()}.
     *
     * @param events the complete published batch
     * @return a future that completes when handling is done
     */
    CompletableFuture<Void> handle(List<DomainEvent> events);

    /** Narrows a batch to the events accepted by this handler's filter. */
    default List<DomainEvent> filter(List<DomainEvent> events) {
        return eventFilter().select(events);
    }
}
