package com.tessera.domain;

/**
 * Ends an entity's life. Applying it marks the entity discarded and yields no entity.
 *
 * @param <E> the entity type
 */
public class EntityDiscarded<E extends DomainEntity> extends EntityEvent<E> {

    private final String originatorTopic;

    public EntityDiscarded(EventHeader header, String originatorTopic) {
        super(header);
        this.originatorTopic = originatorTopic;
    }

    @Override
    public String topic() {
        return originatorTopic + "#Discarded";
    }

    public String originatorTopic() {
        return originatorTopic;
    }

    @Override
    public E apply(E entity) {
        if (entity != null) {
            entity.markDiscarded();
        }
        return null;
    }
}
