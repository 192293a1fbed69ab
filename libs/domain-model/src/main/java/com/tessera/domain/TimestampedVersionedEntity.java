package com.tessera.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity that is both {@link Versioned} and {@link Timestamped}.
 */
public abstract class TimestampedVersionedEntity extends VersionedEntity implements Timestamped {

    private final EntityTimestamps timestamps;

    protected TimestampedVersionedEntity(EntityCreated<?> created) {
        super(created);
        this.timestamps = EntityTimestamps.fromCreated(created);
    }

    protected TimestampedVersionedEntity(UUID id, boolean discarded, long version, EntityTimestamps timestamps) {
        super(id, discarded, version);
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
        super.eventApplied(header);
        timestamps.modified(header.timestamp());
    }

    @Override
    void attributeChanged(EventHeader header) {
        timestamps.updated(header.timestamp());
    }
}
