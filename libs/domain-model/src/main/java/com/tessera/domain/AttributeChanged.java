package com.tessera.domain;

/**
 * Assigns a new value to a named attribute of an entity.
 * <p>
 * The entity applies the value in {@link DomainEntity#applyAttribute(String, Object)};
 * timestamped entities also move their {@code updatedOn} to this event's timestamp.
 *
 * @param <E> the entity type
 */
public class AttributeChanged<E extends DomainEntity> extends EntityEvent<E> {

    private final String originatorTopic;
    private final String name;
    private final Object value;

    public AttributeChanged(EventHeader header, String originatorTopic, String name, Object value) {
        super(header);
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("attribute name must not be null or blank");
        }
        this.originatorTopic = originatorTopic;
        this.name = name;
        this.value = value;
    }

    @Override
    public String topic() {
        return originatorTopic + "#AttributeChanged";
    }

    public String originatorTopic() {
        return originatorTopic;
    }

    public String name() {
        return name;
    }

    public Object value() {
        return value;
    }

    @Override
    protected void mutate(E entity) {
        entity.applyAttribute(name, value);
        entity.attributeChanged(header());
    }
}
