package com.tessera.eventbus;

import com.tessera.eventmodel.DomainEvent;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Default {@link EventBus}.
 * <p>
 * Subscriptions live in a copy-on-write list, so registry mutations are atomic and every publish
 * call walks an immutable snapshot taken when the call starts. Handlers are chained with
 * {@link CompletableFuture#thenCompose}: the next subscription is only visited after the previous
 * handler's future has completed, and a failure skips every remaining handler.
 * <p>
 * Predicate results are cached per publish call, keyed by predicate identity. A predicate shared by
 * several subscriptions is evaluated lazily when the first of them is reached and never again in
 * the same call.
 * <p>
 * An optional handler timeout bounds each handler future; a handler exceeding it fails the
 * publish call with a {@link java.util.concurrent.TimeoutException}.
 */
public final class DefaultEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventBus.class);

    private final CopyOnWriteArrayList<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final EventBusMetrics metrics;
    private final Duration handlerTimeout;

    /**
     * Creates a bus without metrics or handler timeout.
     */
    public DefaultEventBus() {
        this(EventBusMetrics.noop(), null);
    }

    /**
     * Creates a bus.
     *
     * @param metrics        bus instrumentation
     * @param handlerTimeout per-handler timeout, or null for none
     */
    public DefaultEventBus(EventBusMetrics metrics, Duration handlerTimeout) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (handlerTimeout != null && (handlerTimeout.isZero() || handlerTimeout.isNegative())) {
            throw new IllegalArgumentException("handlerTimeout must be positive");
        }
        this.metrics = metrics;
        this.handlerTimeout = handlerTimeout;
    }

    @Override
    public void subscribe(BatchHandler handler, BatchPredicate predicate) {
        add(new PredicateSubscription(predicate, handler));
    }

    @Override
    public void unsubscribe(BatchHandler handler, BatchPredicate predicate) {
        remove(new PredicateSubscription(predicate, handler));
    }

    @Override
    public void subscribe(EventHandler handler) {
        add(new HandlerSubscription(handler));
    }

    @Override
    public void unsubscribe(EventHandler handler) {
        remove(new HandlerSubscription(handler));
    }

    @Override
    public CompletableFuture<Void> publish(List<? extends DomainEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("events must not be null");
        }
        List<DomainEvent> batch = List.copyOf(events);
        List<Subscription> snapshot = List.copyOf(subscriptions);
        Map<BatchPredicate, Boolean> predicateResults = new IdentityHashMap<>();

        log.debug("Publishing {} event(s) to {} subscription(s)", batch.size(), snapshot.size());
        metrics.batchPublished(batch.size());
        Timer.Sample sample = metrics.startPublish();

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Subscription subscription : snapshot) {
            chain = chain.thenCompose(ignored -> dispatch(subscription, batch, predicateResults));
        }
        return chain.whenComplete((ignored, failure) -> metrics.stopPublish(sample, failure == null));
    }

    @Override
    public boolean isEmpty() {
        return subscriptions.isEmpty();
    }

    @Override
    public int size() {
        return subscriptions.size();
    }

    @Override
    public void assertEmpty() {
        List<Subscription> remaining = List.copyOf(subscriptions);
        if (!remaining.isEmpty()) {
            throw new EventHandlersNotEmptyException(remaining.stream().map(Object::toString).toList());
        }
    }

    @Override
    public void clear() {
        subscriptions.clear();
        log.debug("Cleared event bus subscriptions");
    }

    /**
     * Returns the configured per-handler timeout, or null if handlers are unbounded.
     */
    public Duration handlerTimeout() {
        return handlerTimeout;
    }

    private void add(Subscription subscription) {
        if (subscriptions.addIfAbsent(subscription)) {
            log.debug("Subscribed {}", subscription);
        }
    }

    private void remove(Subscription subscription) {
        if (subscriptions.remove(subscription)) {
            log.debug("Unsubscribed {}", subscription);
        }
    }

    private CompletableFuture<Void> dispatch(Subscription subscription, List<DomainEvent> batch,
                                             Map<BatchPredicate, Boolean> predicateResults) {
        if (!subscription.fires(batch, predicateResults, metrics)) {
            return CompletableFuture.completedFuture(null);
        }
        metrics.handlerInvoked(subscription.flavor());
        CompletableFuture<Void> result;
        try {
            result = subscription.deliver(batch);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        if (result == null) {
            result = CompletableFuture.failedFuture(
                    new IllegalStateException(subscription + " returned no future"));
        }
        if (handlerTimeout != null) {
            result = result.copy().orTimeout(handlerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return result.whenComplete((ignored, failure) -> {
            if (failure != null) {
                metrics.handlerFailed(subscription.flavor());
                log.warn("{} failed, remaining subscriptions skipped: {}", subscription, failure.toString());
            }
        });
    }
}
