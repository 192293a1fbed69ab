package com.tessera.domain;

/**
 * Builds an entity event from the header the triggering entity prepared.
 */
@FunctionalInterface
public interface EventConstructor {

    EntityEvent<?> construct(EventHeader header);
}
