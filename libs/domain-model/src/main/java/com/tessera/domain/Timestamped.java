package com.tessera.domain;

import java.time.Instant;

/**
 * Capability of entities that track when they were created and changed.
 */
public interface Timestamped {

    /** Timestamp of the created event. */
    Instant createdOn();

    /** Timestamp of the last attribute change, or of creation. */
    Instant updatedOn();

    /** Timestamp of the last event applied. */
    Instant lastModified();
}
