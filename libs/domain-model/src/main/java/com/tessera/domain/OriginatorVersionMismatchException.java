package com.tessera.domain;

import java.util.UUID;

/**
 * Thrown when an event does not take a versioned entity to exactly its next version.
 */
public class OriginatorVersionMismatchException extends MismatchedOriginatorException {

    private final long currentVersion;
    private final Long eventVersion;

    public OriginatorVersionMismatchException(long currentVersion, Long eventVersion, String eventType,
                                              String entityType, UUID entityId) {
        super("Event takes entity to version %s, but entity is currently at version %d. Event type: '%s', entity type: '%s', entity id: '%s'"
                .formatted(eventVersion, currentVersion, eventType, entityType, entityId));
        this.currentVersion = currentVersion;
        this.eventVersion = eventVersion;
    }

    /** Version of the entity when the event was applied. */
    public long currentVersion() {
        return currentVersion;
    }

    /** Version the event would have taken the entity to; null if the event carried none. */
    public Long eventVersion() {
        return eventVersion;
    }

    /** The only version the event could have carried. */
    public long expectedVersion() {
        return currentVersion + 1;
    }
}
