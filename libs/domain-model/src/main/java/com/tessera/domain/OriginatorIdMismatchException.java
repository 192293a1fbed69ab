package com.tessera.domain;

import java.util.UUID;

/**
 * Thrown when an event's originator id is not the id of the entity it is applied to.
 */
public class OriginatorIdMismatchException extends MismatchedOriginatorException {

    private final UUID entityId;
    private final UUID originatorId;

    public OriginatorIdMismatchException(UUID entityId, UUID originatorId) {
        super("Entity id '%s' not equal to event originator id '%s'".formatted(entityId, originatorId));
        this.entityId = entityId;
        this.originatorId = originatorId;
    }

    /** Id of the entity the event was applied to. */
    public UUID entityId() {
        return entityId;
    }

    /** Id carried by the event. */
    public UUID originatorId() {
        return originatorId;
    }
}
