package com.tessera.domain;

import com.tessera.eventmodel.DomainEventException;

/**
 * Raised when an event cannot be applied to an entity in its current state. The entity is left
 * unchanged.
 */
public class ConsistencyException extends DomainEventException {

    public ConsistencyException(String message) {
        super(message);
    }
}
