package com.tessera.eventbus;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

/**
 * Micrometer instrumentation of an {@link EventBus}.
 * <p>
 * Every meter carries a {@code bus} tag naming the bus instance. Handler meters are additionally
 * tagged with the subscription {@code flavor} ({@code predicate} or {@code handler}), the publish
 * timer with its {@code outcome} ({@code success} or {@code failure}).
 */
public final class EventBusMetrics {

    public static final String PUBLISH_BATCHES = "tessera.bus.publish.batches";
    public static final String PUBLISH_EVENTS = "tessera.bus.publish.events";
    public static final String PUBLISH_DURATION = "tessera.bus.publish.duration";
    public static final String HANDLER_INVOCATIONS = "tessera.bus.handler.invocations";
    public static final String HANDLER_FAILURES = "tessera.bus.handler.failures";
    public static final String PREDICATE_EVALUATIONS = "tessera.bus.predicate.evaluations";

    /** Tag key naming the bus. */
    public static final String TAG_BUS = "bus";

    public static final String TAG_FLAVOR = "flavor";
    public static final String TAG_OUTCOME = "outcome";

    /** Bus name used when none is given. */
    public static final String DEFAULT_BUS_NAME = "default";

    private final MeterRegistry registry;
    private final String busName;
    private final Counter batches;
    private final Counter events;
    private final Counter predicateEvaluations;

    /**
     * Creates metrics bound to the given registry.
     *
     * @param registry the meter registry
     * @param busName  value of the {@code bus} tag
     */
    public EventBusMetrics(MeterRegistry registry, String busName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (busName == null || busName.isBlank()) {
            throw new IllegalArgumentException("busName must not be null or blank");
        }
        this.registry = registry;
        this.busName = busName;
        this.batches = Counter.builder(PUBLISH_BATCHES)
                .description("Batches published on the event bus")
                .tags(baseTags())
                .register(registry);
        this.events = Counter.builder(PUBLISH_EVENTS)
                .description("Events published on the event bus")
                .tags(baseTags())
                .register(registry);
        this.predicateEvaluations = Counter.builder(PREDICATE_EVALUATIONS)
                .description("Subscription predicate evaluations")
                .tags(baseTags())
                .register(registry);
    }

    /** Metrics that record nothing. */
    public static EventBusMetrics noop() {
        return new EventBusMetrics(new CompositeMeterRegistry(), DEFAULT_BUS_NAME);
    }

    void batchPublished(int eventCount) {
        batches.increment();
        events.increment(eventCount);
    }

    void predicateEvaluated() {
        predicateEvaluations.increment();
    }

    void handlerInvoked(String flavor) {
        Counter.builder(HANDLER_INVOCATIONS)
                .description("Event handler invocations")
                .tags(baseTags().and(TAG_FLAVOR, flavor))
                .register(registry)
                .increment();
    }

    void handlerFailed(String flavor) {
        Counter.builder(HANDLER_FAILURES)
                .description("Event handler invocations that failed")
                .tags(baseTags().and(TAG_FLAVOR, flavor))
                .register(registry)
                .increment();
    }

    Timer.Sample startPublish() {
        return Timer.start(registry);
    }

    void stopPublish(Timer.Sample sample, boolean success) {
        sample.stop(Timer.builder(PUBLISH_DURATION)
                .description("Time to deliver a batch to every firing handler")
                .tags(baseTags().and(TAG_OUTCOME, success ? "success" : "failure"))
                .register(registry));
    }

    /** Returns the underlying meter registry. */
    public MeterRegistry registry() {
        return registry;
    }

    public String busName() {
        return busName;
    }

    private Tags baseTags() {
        return Tags.of(TAG_BUS, busName);
    }
}
