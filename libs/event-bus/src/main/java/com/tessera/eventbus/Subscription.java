package com.tessera.eventbus;

import com.tessera.eventmodel.DomainEvent;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry of the {@link DefaultEventBus} registry.
 */
sealed interface Subscription permits PredicateSubscription, HandlerSubscription {

    /**
     * Decides whether this subscription fires for the batch.
     *
     * @param predicateResults results of predicates already evaluated in the current publish call
     */
    boolean fires(List<DomainEvent> events, Map<BatchPredicate, Boolean> predicateResults, EventBusMetrics metrics);

    CompletableFuture<Void> deliver(List<DomainEvent> events);

    /** Metric tag value naming the subscription flavor. */
    String flavor();
}
