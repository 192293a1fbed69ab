package com.tessera.eventmodel;

/**
 * Thrown when a {@link CanonicalEncoder} cannot encode an event's fields.
 */
public class EventEncodingException extends DomainEventException {

    public EventEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
