package com.tessera.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Registration of an entity class: its stable topic and the factory that builds it from its
 * created event.
 * <p>
 * {@link #create(Map)} is the only way to bring a new entity into existence. It registers the type
 * in {@link TopicRegistry#global()}, builds the {@link EntityCreated} event, applies it to no
 * entity and hands the event to the new entity's publish step, which publishes it right away for
 * plain entities and queues it for aggregate roots.
 *
 * @param topic       stable topic of the entity class
 * @param entityClass the entity class
 * @param factory     builds an entity from its created event
 * @param clock       source of the creation timestamp of timestamped entities
 * @param <E>         the entity type
 */
public record EntityType<E extends DomainEntity>(
        String topic, Class<E> entityClass, EntityFactory<E> factory, Clock clock) {

    private static final Logger log = LoggerFactory.getLogger(EntityType.class);

    public EntityType {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be null or blank");
        }
        if (topic.contains("#")) {
            throw new IllegalArgumentException("topic must not contain '#'");
        }
        if (entityClass == null) {
            throw new IllegalArgumentException("entityClass must not be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
    }

    /** Entity type stamping creation with the UTC system clock. */
    public EntityType(String topic, Class<E> entityClass, EntityFactory<E> factory) {
        this(topic, entityClass, factory, Clock.systemUTC());
    }

    /** Entity type whose topic is the class name. */
    public static <E extends DomainEntity> EntityType<E> of(Class<E> entityClass, EntityFactory<E> factory) {
        return new EntityType<>(entityClass.getName(), entityClass, factory);
    }

    /** Copy of this type whose created events are stamped by the given clock. */
    public EntityType<E> withClock(Clock clock) {
        return new EntityType<>(topic, entityClass, factory, clock);
    }

    public boolean isVersioned() {
        return Versioned.class.isAssignableFrom(entityClass);
    }

    public boolean isTimestamped() {
        return Timestamped.class.isAssignableFrom(entityClass);
    }

    /** Creates an entity with a random id. */
    public CompletableFuture<E> create(Map<String, ?> attributes) {
        return create(UUID.randomUUID(), attributes);
    }

    /**
     * Creates an entity with the given id.
     *
     * @return a future completing with the entity once its created event is published or queued
     * @throws TopicResolutionException    if the topic cannot be resolved
     * @throws EntityConstructionException if the factory returns no entity, or one whose id or
     *                                     version differs from its created event
     */
    public CompletableFuture<E> create(UUID id, Map<String, ?> attributes) {
        if (id == null) {
            throw new IllegalArgumentException("id must not be null");
        }
        TopicRegistry.global().register(this);
        EventHeader header = new EventHeader(
                id,
                isVersioned() ? 0L : null,
                isTimestamped() ? Instant.now(clock) : null);
        EntityCreated<E> created = new EntityCreated<>(header, topic, attributes);
        E entity = created.apply(null);
        if (entity == null) {
            throw new EntityConstructionException("Created event of '%s' yielded no entity".formatted(topic));
        }
        if (!id.equals(entity.id())) {
            throw new EntityConstructionException(
                    "Created event of '%s' for %s yielded an entity with id %s".formatted(topic, id, entity.id()));
        }
        if (entity instanceof Versioned versioned && versioned.version() != 0L) {
            throw new EntityConstructionException(
                    "Created event of '%s' yielded an entity at version %d instead of 0"
                            .formatted(topic, versioned.version()));
        }
        log.debug("Created {} {}", topic, id);
        return entity.publish(List.of(created)).thenApply(ignored -> entity);
    }
}
