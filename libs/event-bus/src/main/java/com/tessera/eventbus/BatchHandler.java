package com.tessera.eventbus;

import com.tessera.eventmodel.DomainEvent;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Receives a published batch of events.
 * <p>
 * The returned future completes when the handler is done; the bus waits for it before visiting
 * the next subscription. A failed future (or a thrown exception) fails the whole publish call.
 * <p>
 * Subscriptions are matched by reference, so keep the instance you subscribed in order to
 * unsubscribe it later.
 */
@FunctionalInterface
public interface BatchHandler {

    /**
     * Handles the complete, ordered batch.
     *
     * @param events the published events, never null
     * @return a future that completes when handling is done
     */
    CompletableFuture<Void> handle(List<DomainEvent> events);

    /**
     * Adapts a synchronous consumer. Exceptions thrown by the consumer propagate to the
     * publisher.
     */
    static BatchHandler of(Consumer<List<DomainEvent>> consumer) {
        if (consumer == null) {
            throw new IllegalArgumentException("consumer must not be null");
        }
        return events -> {
            consumer.accept(events);
            return CompletableFuture.completedFuture(null);
        };
    }
}
