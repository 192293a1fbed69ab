package com.tessera.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Originator data carried by every entity event.
 * <p>
 * Which parts are present depends on the entity that produced the event: versioned entities
 * fill in {@code originatorVersion}, timestamped entities fill in {@code timestamp}.
 *
 * @param originatorId      id of the entity the event belongs to (required)
 * @param originatorVersion version the entity has once the event is applied, or null
 * @param timestamp         when the event occurred, or null
 */
public record EventHeader(UUID originatorId, Long originatorVersion, Instant timestamp) {

    public EventHeader {
        if (originatorId == null) {
            throw new IllegalArgumentException("originatorId must not be null");
        }
        if (originatorVersion != null && originatorVersion < 0) {
            throw new IllegalArgumentException("originatorVersion must not be negative");
        }
    }

    /** Header carrying only the originator id. */
    public static EventHeader of(UUID originatorId) {
        return new EventHeader(originatorId, null, null);
    }

    public boolean hasVersion() {
        return originatorVersion != null;
    }

    public boolean hasTimestamp() {
        return timestamp != null;
    }

    public EventHeader withVersion(long version) {
        return new EventHeader(originatorId, version, timestamp);
    }

    public EventHeader withTimestamp(Instant at) {
        return new EventHeader(originatorId, originatorVersion, at);
    }
}
