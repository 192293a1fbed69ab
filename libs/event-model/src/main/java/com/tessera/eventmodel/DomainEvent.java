package com.tessera.eventmodel;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Base type for domain events: immutable records of a state change.
 *
 * <p>Subclasses hold their state in {@code final} fields assigned by the constructor and expose it
 * through accessor methods; there are no setters. The field values are read reflectively by the
 * {@link CanonicalEncoder}, so every field must be encodable (primitives, strings, UUIDs,
 * {@code java.time} values, collections, maps and other objects made of those).
 *
 * <p>Events are compared by content: two events are equal iff their {@link #digest()} values are
 * equal, which covers the topic, every field and the configured salt. This makes events usable as
 * set members and map keys.
 */
public abstract class DomainEvent {

    /**
     * Stable identifier of this event kind. Defaults to the fully-qualified class name.
     */
    public String topic() {
        return getClass().getName();
    }

    /** Field values of this event, sorted by name. */
    public final Map<String, Object> fields() {
        return EventHasher.defaultHasher().fieldsOf(this);
    }

    /** Hex-encoded SHA-256 digest of topic, fields and salt. */
    public final String digest() {
        return EventHasher.defaultHasher().digest(this);
    }

    @Override
    public final boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof DomainEvent event && digest().equals(event.digest());
    }

    @Override
    public final int hashCode() {
        return digest().hashCode();
    }

    /** Renders {@code SimpleName(field=value, ...)}, or just the simple name if encoding fails. */
    @Override
    public String toString() {
        Map<String, Object> fields;
        try {
            fields = fields();
        } catch (EventEncodingException e) {
            return getClass().getSimpleName();
        }
        String args = fields.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
        return getClass().getSimpleName() + "(" + args + ")";
    }
}
