package com.tessera.eventbus;

import com.tessera.eventmodel.DomainEvent;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a subscription fires for a published batch.
 * <p>
 * Within one publish call a predicate instance is evaluated at most once; every subscription that
 * shares the instance observes the cached result. A predicate that accepts the batch delivers the
 * whole batch, including events it did not look at.
 */
@FunctionalInterface
public interface BatchPredicate {

    boolean test(List<DomainEvent> events);

    /** Accepts a batch containing at least one event that is an instance of any given type. */
    @SafeVarargs
    static BatchPredicate anyInstanceOf(Class<? extends DomainEvent>... types) {
        List<Class<? extends DomainEvent>> accepted = List.of(types);
        return events -> events.stream()
                .anyMatch(event -> accepted.stream().anyMatch(type -> type.isInstance(event)));
    }

    /** Accepts a batch containing at least one event with any given topic. */
    static BatchPredicate anyTopic(String... topics) {
        Set<String> accepted = new LinkedHashSet<>(Arrays.asList(topics));
        return events -> events.stream().anyMatch(event -> accepted.contains(event.topic()));
    }
}
