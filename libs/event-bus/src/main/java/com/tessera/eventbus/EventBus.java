package com.tessera.eventbus;

import com.tessera.eventmodel.DomainEvent;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * In-process publish/subscribe of event batches.
 * <p>
 * Two subscription flavors share one ordered registry:
 * <ul>
 *   <li>predicate pairs: a {@link BatchHandler} with an optional {@link BatchPredicate},
 *       deduplicated by pair equality;</li>
 *   <li>self-filtering {@link EventHandler} objects, deduplicated by identity.</li>
 * </ul>
 * Publishing visits subscriptions in the order they were added, one at a time, and stops at the
 * first failing handler. The failure is reported through the returned future.
 */
public interface EventBus {

    /** Subscribes a handler that fires for every batch. */
    default void subscribe(BatchHandler handler) {
        subscribe(handler, null);
    }

    /**
     * Subscribes a handler guarded by a predicate. Subscribing the same pair twice is a no-op.
     *
     * @param handler the handler, not null
     * @param predicate the predicate, or null to always fire
     */
    void subscribe(BatchHandler handler, BatchPredicate predicate);

    default void unsubscribe(BatchHandler handler) {
        unsubscribe(handler, null);
    }

    /** Removes the pair; a pair that is not registered is ignored. */
    void unsubscribe(BatchHandler handler, BatchPredicate predicate);

    /** Subscribes a self-filtering handler. Subscribing the same object twice is a no-op. */
    void subscribe(EventHandler handler);

    void unsubscribe(EventHandler handler);

    /**
     * Delivers the batch to every subscription that fires for it.
     *
     * @param events the ordered batch, not null
     * @return a future that completes once every firing handler has completed, or completes
     *         exceptionally with the first handler failure
     */
    CompletableFuture<Void> publish(List<? extends DomainEvent> events);

    /** Returns true when no subscription is registered. */
    boolean isEmpty();

    /** Number of registered subscriptions across both flavors. */
    int size();

    /**
     * Fails if any subscription is still registered.
     *
     * @throws EventHandlersNotEmptyException listing the remaining subscriptions
     */
    void assertEmpty();

    /** Removes every subscription. */
    void clear();
}
