package com.tessera.domain;

import com.tessera.eventmodel.DomainEventException;

/**
 * Thrown when applying a created event yields no entity.
 */
public class EntityConstructionException extends DomainEventException {

    public EntityConstructionException(String message) {
        super(message);
    }
}
