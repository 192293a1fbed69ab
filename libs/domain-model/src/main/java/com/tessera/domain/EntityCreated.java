package com.tessera.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * First event of every entity: carries the entity topic and the creation attributes.
 * <p>
 * Applying it ignores its argument: the topic is resolved through {@link TopicRegistry#global()}
 * and the registered {@link EntityFactory} builds the entity. A {@value #DISCARDED_ATTRIBUTE}
 * attribute is dropped, so creation always yields a live entity.
 *
 * @param <E> the entity type
 */
public class EntityCreated<E extends DomainEntity> extends EntityEvent<E> {

    /** Attribute name that is never carried into a created entity. */
    public static final String DISCARDED_ATTRIBUTE = "discarded";

    private final String originatorTopic;
    private final Map<String, Object> attributes;

    public EntityCreated(EventHeader header, String originatorTopic, Map<String, ?> attributes) {
        super(header);
        if (originatorTopic == null || originatorTopic.isBlank()) {
            throw new IllegalArgumentException("originatorTopic must not be null or blank");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        if (attributes != null) {
            copy.putAll(attributes);
        }
        copy.remove(DISCARDED_ATTRIBUTE);
        this.originatorTopic = originatorTopic;
        this.attributes = Collections.unmodifiableMap(copy);
    }

    @Override
    public String topic() {
        return originatorTopic + "#Created";
    }

    /** Topic of the entity type being created. */
    public String originatorTopic() {
        return originatorTopic;
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    /** Returns the named attribute, or null if absent. */
    public Object attribute(String name) {
        return attributes.get(name);
    }

    /**
     * Returns the named attribute cast to the given type.
     *
     * @throws ClassCastException if the value has another type
     */
    public <T> T attribute(String name, Class<T> type) {
        return type.cast(attributes.get(name));
    }

    @Override
    public E apply(E entity) {
        EntityType<E> type = TopicRegistry.global().resolve(originatorTopic);
        E created = type.factory().create(this);
        if (created == null) {
            throw new EntityConstructionException(
                    "Factory of entity type '%s' returned no entity".formatted(originatorTopic));
        }
        return created;
    }
}
