package com.tessera.domain;

import com.tessera.eventmodel.DomainEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * Base type of events that belong to an entity.
 * <p>
 * The {@link EventHeader} identifies the originating entity and, depending on the entity's
 * capabilities, the version the event takes it to and the time it occurred. Domain events usually
 * only override {@link #mutate(DomainEntity)}; the entity performs the identity, version and
 * discard checks before calling {@link #apply(DomainEntity)}.
 *
 * @param <E> the entity type this event applies to
 */
public abstract class EntityEvent<E extends DomainEntity> extends DomainEvent {

    private final EventHeader header;

    protected EntityEvent(EventHeader header) {
        if (header == null) {
            throw new IllegalArgumentException("header must not be null");
        }
        this.header = header;
    }

    public EventHeader header() {
        return header;
    }

    public UUID originatorId() {
        return header.originatorId();
    }

    /** Version the originator has once this event is applied; null for unversioned entities. */
    public Long originatorVersion() {
        return header.originatorVersion();
    }

    public Instant timestamp() {
        return header.timestamp();
    }

    /**
     * Applies this event to an entity.
     *
     * @param entity the entity, or null for none
     * @return the resulting entity; the input unless overridden
     */
    public E apply(E entity) {
        if (entity != null) {
            mutate(entity);
        }
        return entity;
    }

    /** Changes the entity's state. Does nothing unless overridden. */
    protected void mutate(E entity) {
    }
}
