package com.tessera.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity that records when it was created, last changed and last modified.
 */
public abstract class TimestampedEntity extends DomainEntity implements Timestamped {

    private final EntityTimestamps timestamps;

    protected TimestampedEntity(EntityCreated<?> created) {
        super(created);
        this.timestamps = EntityTimestamps.fromCreated(created);
    }

    protected TimestampedEntity(UUID id, boolean discarded, EntityTimestamps timestamps) {
        super(id, discarded);
        if (timestamps == null) {
            throw new IllegalArgumentException("timestamps must not be null");
        }
        this.timestamps = timestamps.copy();
    }

    @Override
    public Instant createdOn() {
        return timestamps.createdOn();
    }

    @Override
    public Instant updatedOn() {
        return timestamps.updatedOn();
    }

    @Override
    public Instant lastModified() {
        return timestamps.lastModified();
    }

    @Override
    void eventApplied(EventHeader header) {
        timestamps.modified(header.timestamp());
    }

    @Override
    void attributeChanged(EventHeader header) {
        timestamps.updated(header.timestamp());
    }
}
