package com.tessera.domain;

import com.tessera.eventmodel.DomainEventException;

/**
 * Thrown when a topic is not registered in a {@link TopicRegistry}.
 */
public class TopicResolutionException extends DomainEventException {

    private final String topic;

    public TopicResolutionException(String topic) {
        super("No entity type registered for topic '%s'".formatted(topic));
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }
}
