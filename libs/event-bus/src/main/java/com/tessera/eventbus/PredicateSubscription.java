package com.tessera.eventbus;

import com.tessera.eventmodel.DomainEvent;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A handler with an optional predicate. Equal when both handler and predicate are equal.
 */
record PredicateSubscription(BatchPredicate predicate, BatchHandler handler) implements Subscription {

    PredicateSubscription {
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
    }

    @Override
    public boolean fires(List<DomainEvent> events, Map<BatchPredicate, Boolean> predicateResults,
                         EventBusMetrics metrics) {
        if (predicate == null) {
            return true;
        }
        Boolean cached = predicateResults.get(predicate);
        if (cached != null) {
            return cached;
        }
        boolean result = predicate.test(events);
        metrics.predicateEvaluated();
        predicateResults.put(predicate, result);
        return result;
    }

    @Override
    public CompletableFuture<Void> deliver(List<DomainEvent> events) {
        return handler.handle(events);
    }

    @Override
    public String flavor() {
        return "predicate";
    }

    @Override
    public String toString() {
        return "PredicateSubscription[handler=" + handler + ", predicate=" + predicate + "]";
    }
}
