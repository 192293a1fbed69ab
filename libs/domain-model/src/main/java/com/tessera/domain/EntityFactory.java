package com.tessera.domain;

/**
 * Builds a new entity from its created event.
 *
 * @param <E> the entity type
 */
@FunctionalInterface
public interface EntityFactory<E extends DomainEntity> {

    E create(EntityCreated<E> created);
}
