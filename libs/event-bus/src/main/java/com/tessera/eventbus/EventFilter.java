package com.tessera.eventbus;

import com.tessera.eventmodel.DomainEvent;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Filtering rule declared by a self-filtering {@link EventHandler}.
 * <p>
 * A filter either accepts every event ({@link #all()}, the {@value #ASTERISK} wildcard), events
 * whose runtime type is one of a fixed set of classes, or events whose topic is one of a fixed set
 * of topics.
 *
 * @param wildcard true for the accept-all filter
 * @param types accepted event classes (matched with {@link Class#isInstance})
 * @param topics accepted event topics
 */
public record EventFilter(boolean wildcard, Set<Class<? extends DomainEvent>> types, Set<String> topics) {

    /** Marker for the accept-all filter. */
    public static final String ASTERISK = "*";

    private static final EventFilter ALL = new EventFilter(true, Set.of(), Set.of());

    public EventFilter {
        types = types == null ? Set.of() : Set.copyOf(types);
        topics = topics == null ? Set.of() : Set.copyOf(topics);
    }

    public static EventFilter all() {
        return ALL;
    }

    @SafeVarargs
    public static EventFilter ofTypes(Class<? extends DomainEvent>... types) {
        if (types.length == 0) {
            throw new IllegalArgumentException("at least one event type is required");
        }
        return new EventFilter(false, new LinkedHashSet<>(Arrays.asList(types)), Set.of());
    }

    /**
     * Builds a topic filter. A single {@value #ASTERISK} topic yields {@link #all()}.
     */
    public static EventFilter ofTopics(String... topics) {
        if (topics.length == 0) {
            throw new IllegalArgumentException("at least one topic is required");
        }
        if (topics.length == 1 && ASTERISK.equals(topics[0])) {
            return ALL;
        }
        return new EventFilter(false, Set.of(), new LinkedHashSet<>(Arrays.asList(topics)));
    }

    /** Returns true if this filter accepts the given event. */
    public boolean accepts(DomainEvent event) {
        if (wildcard) {
            return true;
        }
        if (topics.contains(event.topic())) {
            return true;
        }
        for (Class<? extends DomainEvent> type : types) {
            if (type.isInstance(event)) {
                return true;
            }
        }
        return false;
    }

    /** Returns true if any event of the batch is accepted. */
    public boolean matches(List<? extends DomainEvent> events) {
        if (wildcard) {
            return true;
        }
        for (DomainEvent event : events) {
            if (accepts(event)) {
                return true;
            }
        }
        return false;
    }

    /** Returns the accepted events of the batch, in their original order. */
    public List<DomainEvent> select(List<? extends DomainEvent> events) {
        if (wildcard) {
            return List.copyOf(events);
        }
        return events.stream().filter(this::accepts).map(DomainEvent.class::cast).toList();
    }
}
