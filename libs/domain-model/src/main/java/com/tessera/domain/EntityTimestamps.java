package com.tessera.domain;

import java.time.Instant;

/**
 * Mutable timestamp bookkeeping shared by the timestamped entity classes.
 */
public final class EntityTimestamps {

    private final Instant createdOn;
    private Instant updatedOn;
    private Instant lastModified;

    public EntityTimestamps(Instant createdOn, Instant updatedOn, Instant lastModified) {
        if (createdOn == null || updatedOn == null || lastModified == null) {
            throw new IllegalArgumentException("timestamps must not be null");
        }
        this.createdOn = createdOn;
        this.updatedOn = updatedOn;
        this.lastModified = lastModified;
    }

    /** Timestamps of an entity that was just created at the given instant. */
    public static EntityTimestamps createdAt(Instant createdOn) {
        return new EntityTimestamps(createdOn, createdOn, createdOn);
    }

    /** Independent copy of these timestamps. */
    EntityTimestamps copy() {
        return new EntityTimestamps(createdOn, updatedOn, lastModified);
    }

    static EntityTimestamps fromCreated(EntityCreated<?> created) {
        if (!created.header().hasTimestamp()) {
            throw new IllegalArgumentException("Created event for a timestamped entity carries no timestamp");
        }
        return createdAt(created.timestamp());
    }

    public Instant createdOn() {
        return createdOn;
    }

    public Instant updatedOn() {
        return updatedOn;
    }

    public Instant lastModified() {
        return lastModified;
    }

    void modified(Instant at) {
        if (at != null) {
            lastModified = at;
        }
    }

    void updated(Instant at) {
        if (at != null) {
            updatedOn = at;
        }
    }
}
