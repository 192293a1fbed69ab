package com.tessera.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps stable topic strings to {@link EntityType}s and back.
 * <p>
 * The mapping is a bijection between topics and entity classes: a topic can name only one class
 * and a class is known under only one topic. Registering an existing topic/class pair again
 * replaces its factory.
 * <p>
 * {@link EntityCreated} resolves entity types through the {@link #global()} instance.
 */
public final class TopicRegistry {

    private static final Logger log = LoggerFactory.getLogger(TopicRegistry.class);

    private static final TopicRegistry GLOBAL = new TopicRegistry();

    private final Map<String, EntityType<?>> typesByTopic = new ConcurrentHashMap<>();
    private final Map<Class<?>, String> topicsByClass = new ConcurrentHashMap<>();

    /** Returns the process-wide registry. */
    public static TopicRegistry global() {
        return GLOBAL;
    }

    /**
     * Registers an entity type.
     *
     * @throws IllegalArgumentException if the topic is taken by another class, or the class is
     *                                  registered under another topic
     */
    public synchronized void register(EntityType<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        EntityType<?> existing = typesByTopic.get(type.topic());
        if (existing != null && existing.entityClass() != type.entityClass()) {
            throw new IllegalArgumentException("Topic '%s' is already registered for %s"
                    .formatted(type.topic(), existing.entityClass().getName()));
        }
        String existingTopic = topicsByClass.get(type.entityClass());
        if (existingTopic != null && !existingTopic.equals(type.topic())) {
            throw new IllegalArgumentException("%s is already registered under topic '%s'"
                    .formatted(type.entityClass().getName(), existingTopic));
        }
        typesByTopic.put(type.topic(), type);
        topicsByClass.put(type.entityClass(), type.topic());
        if (existing == null) {
            log.debug("Registered entity type {} as '{}'", type.entityClass().getName(), type.topic());
        }
    }

    /**
     * Returns the entity type registered for the topic.
     *
     * @throws TopicResolutionException if the topic is unknown
     */
    @SuppressWarnings("unchecked")
    public <E extends DomainEntity> EntityType<E> resolve(String topic) {
        EntityType<?> type = topic == null ? null : typesByTopic.get(topic);
        if (type == null) {
            throw new TopicResolutionException(topic);
        }
        return (EntityType<E>) type;
    }

    /** Returns the topic of a class, or its name when it is not registered. */
    public String topicOf(Class<?> entityClass) {
        String topic = topicsByClass.get(entityClass);
        return topic != null ? topic : entityClass.getName();
    }

    public boolean contains(String topic) {
        return typesByTopic.containsKey(topic);
    }

    /** Registered entity types, in no particular order. */
    public List<EntityType<?>> types() {
        return List.copyOf(typesByTopic.values());
    }

    public int size() {
        return typesByTopic.size();
    }

    public synchronized void clear() {
        typesByTopic.clear();
        topicsByClass.clear();
    }
}
