package com.tessera.domain;

import java.util.UUID;

/**
 * Entity that counts the events applied to it.
 * <p>
 * An event is accepted only if it takes the entity to exactly {@code version() + 1}; the created
 * event carries version 0.
 */
public abstract class VersionedEntity extends DomainEntity implements Versioned {

    private long version;

    protected VersionedEntity(EntityCreated<?> created) {
        super(created);
        this.version = requireVersion(created);
    }

    protected VersionedEntity(UUID id, boolean discarded, long version) {
        super(id, discarded);
        if (version < 0) {
            throw new IllegalArgumentException("version must not be negative");
        }
        this.version = version;
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    void checkVersion(EntityEvent<?> event) {
        Long eventVersion = event.originatorVersion();
        if (eventVersion == null || eventVersion != version + 1) {
            throw new OriginatorVersionMismatchException(version, eventVersion,
                    event.getClass().getSimpleName(), getClass().getSimpleName(), id());
        }
    }

    @Override
    void eventApplied(EventHeader header) {
        version = header.originatorVersion();
    }

    private static long requireVersion(EntityCreated<?> created) {
        if (!created.header().hasVersion()) {
            throw new IllegalArgumentException("Created event for a versioned entity carries no version");
        }
        return created.originatorVersion();
    }
}
