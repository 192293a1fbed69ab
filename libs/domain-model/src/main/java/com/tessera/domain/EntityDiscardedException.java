package com.tessera.domain;

import com.tessera.eventmodel.DomainEventException;

import java.util.UUID;

/**
 * Thrown when an event is triggered on, or applied to, a discarded entity.
 */
public class EntityDiscardedException extends DomainEventException {

    private final UUID entityId;

    public EntityDiscardedException(UUID entityId) {
        super("Entity '%s' is discarded".formatted(entityId));
        this.entityId = entityId;
    }

    public UUID entityId() {
        return entityId;
    }
}
