package com.tessera.domain;

import com.tessera.eventbus.EventBusHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Base type of event-sourced entities: an immutable id and a discarded flag, changed only by
 * applying {@link EntityEvent}s.
 * <p>
 * Every state change goes through {@link #triggerEvent(EventConstructor)}: the entity builds the
 * next {@link EventHeader}, constructs the event, applies it with {@link #mutate(EntityEvent)} and
 * publishes it on the process-wide bus ({@link EventBusHolder}). {@link AggregateRoot} queues
 * instead of publishing.
 * <p>
 * Instances are not thread-safe; a single entity must not be changed concurrently.
 */
public abstract class DomainEntity {

    private static final Logger log = LoggerFactory.getLogger(DomainEntity.class);

    private final UUID id;
    private boolean discarded;

    /** Builds a live entity from its created event. */
    protected DomainEntity(EntityCreated<?> created) {
        this(requireCreated(created).originatorId(), false);
    }

    /** Rebuilds an entity from known state. */
    protected DomainEntity(UUID id, boolean discarded) {
        if (id == null) {
            throw new IllegalArgumentException("id must not be null");
        }
        this.id = id;
        this.discarded = discarded;
    }

    public UUID id() {
        return id;
    }

    public boolean isDiscarded() {
        return discarded;
    }

    /**
     * Constructs, applies and publishes an event.
     *
     * @param constructor builds the event from the prepared header
     * @return a future completing when the event has been published (or queued)
     * @throws EntityDiscardedException if this entity is discarded
     * @throws ConsistencyException     if the constructed event does not fit this entity
     */
    public CompletableFuture<Void> triggerEvent(EventConstructor constructor) {
        if (constructor == null) {
            throw new IllegalArgumentException("constructor must not be null");
        }
        assertNotDiscarded();
        EntityEvent<?> event = constructor.construct(nextHeader());
        if (event == null) {
            throw new IllegalArgumentException("constructor returned no event");
        }
        mutate(event);
        log.debug("Triggered {} on {}", event.topic(), id);
        return publish(List.of(event));
    }

    /**
     * Assigns a new attribute value by triggering an {@link AttributeChanged} event.
     *
     * @throws IllegalArgumentException if this entity has no such attribute
     */
    public CompletableFuture<Void> changeAttribute(String name, Object value) {
        String topic = entityTopic();
        return triggerEvent(header -> new AttributeChanged<>(header, topic, name, value));
    }

    /** Discards this entity by triggering an {@link EntityDiscarded} event. */
    public CompletableFuture<Void> discard() {
        String topic = entityTopic();
        return triggerEvent(header -> new EntityDiscarded<>(header, topic));
    }

    /**
     * Applies an event to this entity.
     * <p>
     * Checks, in order, that the entity is not discarded, that the event belongs to it and, for
     * versioned entities, that the event takes it to exactly the next version. Nothing changes when
     * a check fails. Otherwise the event's own mutation runs, then the entity's version and
     * last-modified time follow the event header.
     */
    @SuppressWarnings("unchecked")
    public final void mutate(EntityEvent<?> event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        assertNotDiscarded();
        if (!id.equals(event.originatorId())) {
            throw new OriginatorIdMismatchException(id, event.originatorId());
        }
        checkVersion(event);
        ((EntityEvent<DomainEntity>) event).apply(this);
        eventApplied(event.header());
    }

    /**
     * Applies a changed attribute value. Subclasses handle their own attributes and delegate the
     * rest here.
     *
     * @throws IllegalArgumentException always; no attribute is known at this level
     */
    protected void applyAttribute(String name, Object value) {
        throw new IllegalArgumentException("%s has no attribute '%s'".formatted(getClass().getSimpleName(), name));
    }

    /** Hands newly triggered events to the bus. */
    protected CompletableFuture<Void> publish(List<? extends EntityEvent<?>> events) {
        return EventBusHolder.get().publish(events);
    }

    /** Clock used for event timestamps. */
    protected Clock clock() {
        return Clock.systemUTC();
    }

    /** Topic of this entity's class in the global {@link TopicRegistry}. */
    protected String entityTopic() {
        return TopicRegistry.global().topicOf(getClass());
    }

    EventHeader nextHeader() {
        Long version = this instanceof Versioned versioned ? versioned.version() + 1 : null;
        Instant timestamp = this instanceof Timestamped ? Instant.now(clock()) : null;
        return new EventHeader(id, version, timestamp);
    }

    void checkVersion(EntityEvent<?> event) {
    }

    void eventApplied(EventHeader header) {
    }

    void attributeChanged(EventHeader header) {
    }

    void markDiscarded() {
        discarded = true;
    }

    private void assertNotDiscarded() {
        if (discarded) {
            throw new EntityDiscardedException(id);
        }
    }

    private static EntityCreated<?> requireCreated(EntityCreated<?> created) {
        if (created == null) {
            throw new IllegalArgumentException("created event must not be null");
        }
        return created;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id=" + id + (discarded ? ", discarded" : "") + "]";
    }
}
